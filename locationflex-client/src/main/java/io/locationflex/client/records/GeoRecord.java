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

import java.util.List;
import java.util.Map;

/**
 * A synthetic geolocation record describing one IPv4 address.
 *
 * <p>Serialized with snake_case property names.
 */
public record GeoRecord(
        String ip,
        String network,
        boolean isPrivate,
        Location location,
        NetworkInfo networkInfo,
        Security security,
        String gateway,
        String subnetMask,
        List<String> dnsServers,
        String notes,
        List<String> tags,
        Map<String, String> customFields) {

    public record Location(
            String countryCode,
            String countryName,
            String state,
            String city,
            String zipCode,
            String postalCode,
            double latitude,
            double longitude,
            String region,
            String areaCode,
            int metroCode,
            String timezoneId,
            int utcOffset,
            boolean dstActive) {}

    public record NetworkInfo(
            String networkType,
            String isp,
            String organization,
            int asn,
            String asnName,
            String connectionType,
            String usageType,
            String domain,
            String hostname,
            String carrier,
            String lineSpeed,
            boolean staticIp,
            String bandwidthTier,
            int estimatedUsers) {}

    public record Security(
            boolean vpnDetected,
            boolean proxyDetected,
            double reputationScore,
            String lastSeenMalware,
            boolean gdprApplicable,
            int dataRetentionDays,
            String privacyLevel) {}
}
