package com.platform.secretsync.crypto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code sops} block of an encrypted document: wrapped data keys plus integrity data.
 */
record SopsMetadata(List<AgeStanza> age, List<PgpStanza> pgp, String mac, String lastModified,
                    boolean macOnlyEncrypted) {

    record AgeStanza(String recipient, String enc) {
    }

    record PgpStanza(String fingerprint, String enc) {
    }

    private static final Pattern DOTENV_GROUP = Pattern.compile("sops_(age|pgp)__list_(\\d+)__map_(\\w+)");

    boolean hasKeyGroups() {
        return !age.isEmpty() || !pgp.isEmpty();
    }

    static SopsMetadata fromYaml(JsonNode sops) {
        List<AgeStanza> age = new ArrayList<>();
        for (JsonNode entry : sops.path("age")) {
            age.add(new AgeStanza(entry.path("recipient").asText(null), entry.path("enc").asText(null)));
        }
        List<PgpStanza> pgp = new ArrayList<>();
        for (JsonNode entry : sops.path("pgp")) {
            pgp.add(new PgpStanza(entry.path("fp").asText(null), entry.path("enc").asText(null)));
        }
        return new SopsMetadata(age, pgp,
            sops.path("mac").asText(null),
            sops.path("lastmodified").asText(null),
            sops.path("mac_only_encrypted").asBoolean(false));
    }

    /**
     * Builds metadata from the flattened {@code sops_*} lines of a dotenv document.
     *
     * @param entries line keys without modification, values with {@code \n} escapes still present
     */
    static SopsMetadata fromDotenv(Map<String, String> entries) {
        Map<Integer, Map<String, String>> ageGroups = new TreeMap<>();
        Map<Integer, Map<String, String>> pgpGroups = new TreeMap<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            Matcher matcher = DOTENV_GROUP.matcher(entry.getKey());
            if (!matcher.matches()) {
                continue;
            }
            Map<Integer, Map<String, String>> groups = "age".equals(matcher.group(1)) ? ageGroups : pgpGroups;
            groups.computeIfAbsent(Integer.parseInt(matcher.group(2)), i -> new TreeMap<>())
                .put(matcher.group(3), unescape(entry.getValue()));
        }
        List<AgeStanza> age = ageGroups.values().stream()
            .map(fields -> new AgeStanza(fields.get("recipient"), fields.get("enc")))
            .toList();
        List<PgpStanza> pgp = pgpGroups.values().stream()
            .map(fields -> new PgpStanza(fields.get("fp"), fields.get("enc")))
            .toList();
        return new SopsMetadata(age, pgp,
            entries.get("sops_mac"),
            entries.get("sops_lastmodified"),
            Boolean.parseBoolean(entries.getOrDefault("sops_mac_only_encrypted", "false")));
    }

    static String unescape(String value) {
        return value == null ? null : value.replace("\\n", "\n");
    }
}
