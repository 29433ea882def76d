/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.locationflex.client.records;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.google.common.hash.Hashing;
import com.google.common.net.InetAddresses;
import io.locationflex.api.RecordSource;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import lombok.NonNull;

/**
 * Deterministic {@link RecordSource} producing geolocation records of roughly one kilobyte. The
 * content of a record only depends on the identifier it describes.
 */
public class SampleRecordSource implements RecordSource {

    public static final int DefaultCycle = 100;

    private static final ObjectMapper MAPPER =
            new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private final byte[][] samples;
    private final double averagePayloadSize;

    public SampleRecordSource() {
        this(DefaultCycle);
    }

    public SampleRecordSource(int cycle) {
        if (cycle <= 0) {
            throw new IllegalArgumentException("cycle must be greater than zero: " + cycle);
        }
        samples = new byte[cycle][];
        long total = 0;
        for (int i = 0; i < cycle; i++) {
            samples[i] = generate(sampleAddress(i));
            total += samples[i].length;
        }
        averagePayloadSize = (double) total / cycle;
    }

    /** @return The address sample {@code i} is derived from, {@code 10.0.<i / 256>.<i % 256>}. */
    public static @NonNull String sampleAddress(int i) {
        return "10.0." + (i / 256) + "." + (i % 256);
    }

    @Override
    public byte @NonNull [] generate(long id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must not be negative: " + id);
        }
        return samples[(int) (id % samples.length)];
    }

    @Override
    public byte @NonNull [] generate(@NonNull String identifier) {
        try {
            return MAPPER.writeValueAsString(record(identifier)).getBytes(UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record for " + identifier, e);
        }
    }

    @Override
    public int cycle() {
        return samples.length;
    }

    @Override
    public double averagePayloadSize() {
        return averagePayloadSize;
    }

    @NonNull
    GeoRecord record(@NonNull String identifier) {
        boolean isPrivate = isPrivate(identifier);
        return new GeoRecord(
                identifier,
                networkOf(identifier),
                isPrivate,
                location(new Random(seed(identifier))),
                networkInfo(identifier, isPrivate, new Random(seed("network_" + identifier))),
                security(isPrivate, new Random(seed("security_" + identifier))),
                gatewayOf(identifier),
                "255.255.255.0",
                pick(SampleData.DNS_SERVERS, 2, 4, new Random(seed("dns_" + identifier))),
                SampleData.NOTES.get(
                        new Random(seed("notes_" + identifier)).nextInt(SampleData.NOTES.size())),
                pick(SampleData.TAGS, 2, 5, new Random(seed("tags_" + identifier))),
                customFields(new Random(seed("custom_" + identifier))));
    }

    private static GeoRecord.Location location(Random random) {
        SampleData.City city = SampleData.CITIES.get(random.nextInt(SampleData.CITIES.size()));
        double latitude = round(city.latitude() + uniform(random, -0.1, 0.1));
        double longitude = round(city.longitude() + uniform(random, -0.1, 0.1));
        String region = oneOf(SampleData.REGIONS, random);
        String areaCode = String.valueOf(200 + random.nextInt(800));
        int metroCode = 500 + random.nextInt(401);
        String postalCode =
                "US".equals(city.countryCode())
                        ? city.zipCode() + "-" + (1000 + random.nextInt(9000))
                        : city.zipCode();
        return new GeoRecord.Location(
                city.countryCode(),
                city.countryName(),
                city.state(),
                city.city(),
                city.zipCode(),
                postalCode,
                latitude,
                longitude,
                region,
                areaCode,
                metroCode,
                city.timezoneId(),
                city.utcOffset(),
                random.nextBoolean());
    }

    private static GeoRecord.NetworkInfo networkInfo(
            String identifier, boolean isPrivate, Random random) {
        String hostPart = "host-" + identifier.replace('.', '-');
        String networkType;
        String isp;
        String organization;
        String domain;
        if (isPrivate) {
            networkType = "private";
            isp = "Internal Network";
            organization = "Private Organization";
            domain = "internal.local";
        } else {
            networkType = oneOf(SampleData.NETWORK_TYPES, random);
            isp = oneOf(SampleData.ISPS, random);
            organization = oneOf(SampleData.ORGANIZATIONS, random);
            domain = oneOf(SampleData.DOMAINS, random);
        }
        SampleData.Asn asn = oneOf(SampleData.ASNS, random);
        return new GeoRecord.NetworkInfo(
                networkType,
                isp,
                organization,
                asn.number(),
                asn.name(),
                oneOf(SampleData.CONNECTION_TYPES, random),
                oneOf(SampleData.USAGE_TYPES, random),
                domain,
                hostPart + "." + domain,
                "mobile".equals(networkType) ? oneOf(SampleData.CARRIERS, random) : "",
                oneOf(SampleData.LINE_SPEEDS, random),
                random.nextBoolean(),
                oneOf(SampleData.BANDWIDTH_TIERS, random),
                1 + random.nextInt(500));
    }

    private static GeoRecord.Security security(boolean isPrivate, Random random) {
        boolean vpn = random.nextBoolean();
        boolean proxy = random.nextBoolean();
        return new GeoRecord.Security(
                !isPrivate && vpn,
                !isPrivate && proxy,
                Math.round(uniform(random, 0.0, 100.0) * 100.0) / 100.0,
                random.nextDouble() > 0.3 ? "never" : "2024-09-15T10:30:00Z",
                random.nextBoolean(),
                oneOf(SampleData.RETENTION_DAYS, random),
                oneOf(SampleData.PRIVACY_LEVELS, random));
    }

    private static Map<String, String> customFields(Random random) {
        var fields = new LinkedHashMap<String, String>();
        fields.put("scan_frequency", oneOf(List.of("daily", "weekly", "monthly"), random));
        fields.put("monitoring_level", oneOf(List.of("basic", "enhanced", "premium"), random));
        fields.put(
                "compliance_status", oneOf(List.of("compliant", "pending", "non-compliant"), random));
        fields.put("last_updated", "2024-09-22T17:30:00Z");
        fields.put("data_source", "LocationFlex-Enhanced-v1.0");
        return fields;
    }

    private static long seed(String value) {
        return Hashing.md5().hashString(value, UTF_8).asLong();
    }

    private static boolean isPrivate(String identifier) {
        if (!InetAddresses.isInetAddress(identifier)) {
            return false;
        }
        InetAddress address = InetAddresses.forString(identifier);
        return address.isSiteLocalAddress() || address.isLoopbackAddress();
    }

    private static String networkOf(String identifier) {
        int lastDot = identifier.lastIndexOf('.');
        if (!InetAddresses.isInetAddress(identifier) || lastDot < 0) {
            return "";
        }
        return identifier.substring(0, lastDot) + ".0/24";
    }

    private static String gatewayOf(String identifier) {
        int lastDot = identifier.lastIndexOf('.');
        if (!InetAddresses.isInetAddress(identifier) || lastDot < 0) {
            return "";
        }
        return identifier.substring(0, lastDot) + ".1";
    }

    private static <T> T oneOf(List<T> values, Random random) {
        return values.get(random.nextInt(values.size()));
    }

    private static List<String> pick(List<String> values, int min, int max, Random random) {
        var shuffled = new ArrayList<>(values);
        Collections.shuffle(shuffled, random);
        int count = min + random.nextInt(max - min + 1);
        return List.copyOf(shuffled.subList(0, count));
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
