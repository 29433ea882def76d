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
import lombok.experimental.UtilityClass;

@UtilityClass
class SampleData {

    record City(
            String countryCode,
            String countryName,
            String state,
            String city,
            String zipCode,
            double latitude,
            double longitude,
            String timezoneId,
            int utcOffset) {}

    record Asn(int number, String name) {}

    static final List<City> CITIES =
            List.of(
                    new City("US", "United States", "California", "San Francisco", "94102", 37.7749, -122.4194, "America/Los_Angeles", -28800),
                    new City("US", "United States", "New York", "New York", "10001", 40.7128, -74.0060, "America/New_York", -18000),
                    new City("US", "United States", "Texas", "Austin", "73301", 30.2672, -97.7431, "America/Chicago", -21600),
                    new City("GB", "United Kingdom", "England", "London", "SW1A 1AA", 51.5074, -0.1278, "Europe/London", 0),
                    new City("DE", "Germany", "Bavaria", "Munich", "80331", 48.1351, 11.5820, "Europe/Berlin", 3600),
                    new City("JP", "Japan", "Tokyo", "Tokyo", "100-0001", 35.6762, 139.6503, "Asia/Tokyo", 32400),
                    new City("AU", "Australia", "New South Wales", "Sydney", "2000", -33.8688, 151.2093, "Australia/Sydney", 36000),
                    new City("CA", "Canada", "Ontario", "Toronto", "M5H 2N2", 43.6532, -79.3832, "America/Toronto", -18000),
                    new City("FR", "France", "Île-de-France", "Paris", "75001", 48.8566, 2.3522, "Europe/Paris", 3600),
                    new City("BR", "Brazil", "São Paulo", "São Paulo", "01310-100", -23.5505, -46.6333, "America/Sao_Paulo", -10800),
                    new City("IN", "India", "Maharashtra", "Mumbai", "400001", 19.0760, 72.8777, "Asia/Kolkata", 19800),
                    new City("SG", "Singapore", "Singapore", "Singapore", "018989", 1.3521, 103.8198, "Asia/Singapore", 28800));

    static final List<String> NETWORK_TYPES =
            List.of("business", "residential", "mobile", "hosting", "education", "government");
    static final List<String> ISPS =
            List.of(
                    "Comcast", "Verizon", "AT&T", "Charter", "CenturyLink", "Cox", "Optimum", "Spectrum",
                    "Xfinity", "T-Mobile", "Amazon AWS", "Google Cloud", "Microsoft Azure", "DigitalOcean",
                    "Cloudflare");
    static final List<String> ORGANIZATIONS =
            List.of(
                    "Enterprise Corp", "Tech Solutions Inc", "Global Networks Ltd", "Data Systems LLC",
                    "Cloud Services Co", "Internet Provider Inc", "Telecom Solutions", "Business Networks",
                    "Hosting Services", "ISP Corporation");
    static final List<String> CONNECTION_TYPES =
            List.of("cable", "dsl", "fiber", "satellite", "cellular", "t1", "t3", "ethernet", "wireless");
    static final List<String> USAGE_TYPES =
            List.of(
                    "commercial", "residential", "educational", "government", "military", "healthcare",
                    "financial");
    static final List<String> BANDWIDTH_TIERS =
            List.of("low", "medium", "high", "enterprise", "premium", "unlimited");
    static final List<String> CARRIERS =
            List.of(
                    "Verizon Wireless", "AT&T Mobility", "T-Mobile USA", "Sprint", "US Cellular", "Cricket",
                    "Metro PCS");
    static final List<String> LINE_SPEEDS =
            List.of(
                    "56k", "128k", "256k", "512k", "1Mbps", "5Mbps", "10Mbps", "25Mbps", "50Mbps", "100Mbps",
                    "1Gbps");
    static final List<String> PRIVACY_LEVELS =
            List.of("public", "restricted", "private", "confidential", "classified");
    static final List<String> REGIONS =
            List.of(
                    "North America", "South America", "Europe", "Asia Pacific", "Middle East", "Africa",
                    "Oceania");
    static final List<String> TAGS =
            List.of(
                    "datacenter", "residential", "mobile", "vpn", "proxy", "tor", "malware", "botnet",
                    "scanner", "legitimate");
    static final List<Asn> ASNS =
            List.of(
                    new Asn(15169, "Google LLC"),
                    new Asn(8075, "Microsoft Corporation"),
                    new Asn(16509, "Amazon.com Inc"),
                    new Asn(13335, "Cloudflare Inc"),
                    new Asn(7922, "Comcast Cable Communications"),
                    new Asn(701, "Verizon Business"),
                    new Asn(7018, "AT&T Services Inc"),
                    new Asn(20115, "Charter Communications"),
                    new Asn(3356, "Level 3 Parent LLC"),
                    new Asn(174, "Cogent Communications"));
    static final List<String> DOMAINS =
            List.of("example.com", "test.org", "sample.net", "demo.co", "corp.internal", "business.local");
    static final List<String> DNS_SERVERS =
            List.of("8.8.8.8", "8.8.4.4", "1.1.1.1", "1.0.0.1", "208.67.222.222", "208.67.220.220");
    static final List<Integer> RETENTION_DAYS = List.of(30, 90, 180, 365, 1095);
    static final List<String> NOTES =
            List.of(
                    "High-traffic IP address with consistent usage patterns. Monitored for security compliance.",
                    "Corporate network endpoint with standard business applications. Regular security scans performed.",
                    "Residential broadband connection with typical consumer usage. No security concerns identified.",
                    "Mobile device connection with variable location data. Standard carrier security policies applied.",
                    "Data center hosting environment with multiple virtual instances. Enhanced monitoring enabled.",
                    "Educational institution network with student and faculty access. Content filtering active.",
                    "Government network segment with restricted access policies. High security classification required.");
}
