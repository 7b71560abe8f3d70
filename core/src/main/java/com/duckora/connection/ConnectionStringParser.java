package com.duckora.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses attach targets into {@link OracleConnectionParameters}.
 *
 * <p>Three forms are accepted:
 * <pre>
 *   host=db port=1521 service=ORCL user=hr password='p w'     -- key/value
 *   //db:1521/ORCL user=hr password=secret                     -- easy-connect
 *   alias PRODDB user=hr password=secret                       -- TNS alias
 * </pre>
 * A target starting with {@code //} is always easy-connect. Values may be
 * wrapped in single quotes to contain spaces. Key synonyms:
 * {@code service}/{@code service_name}, {@code user}/{@code username},
 * {@code wallet}/{@code wallet_location}, {@code tns}/{@code alias}.
 */
public final class ConnectionStringParser {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionStringParser.class);

    private ConnectionStringParser() {
    }

    /**
     * Parses an attach target.
     *
     * @param target the attach target text
     * @return the connection parameters
     * @throws IllegalArgumentException if a numeric value is malformed or the
     *         easy-connect address cannot be read
     */
    public static OracleConnectionParameters parse(String target) {
        String text = target == null ? "" : target.trim();

        if (text.startsWith("//")) {
            return parseEasyConnect(text);
        }

        if (startsWithWord(text, "alias")) {
            String rest = text.substring("alias".length()).trim();
            int space = indexOfWhitespace(rest);
            String alias = space < 0 ? rest : rest.substring(0, space);
            String kvPart = space < 0 ? "" : rest.substring(space);
            if (alias.isEmpty() || alias.contains("=")) {
                throw new IllegalArgumentException("Missing alias name in: " + target);
            }
            OracleConnectionParameters.Builder builder = OracleConnectionParameters.builder().alias(alias);
            applyKeyValues(builder, parseKeyValues(kvPart), false);
            return builder.build();
        }

        OracleConnectionParameters.Builder builder = OracleConnectionParameters.builder();
        applyKeyValues(builder, parseKeyValues(text), true);
        return builder.build();
    }

    private static OracleConnectionParameters parseEasyConnect(String text) {
        int space = indexOfWhitespace(text);
        String address = (space < 0 ? text : text.substring(0, space)).substring(2);
        String kvPart = space < 0 ? "" : text.substring(space);

        OracleConnectionParameters.Builder builder = OracleConnectionParameters.builder();
        int slash = address.indexOf('/');
        String hostPort = slash < 0 ? address : address.substring(0, slash);
        if (slash >= 0 && slash + 1 < address.length()) {
            builder.serviceName(address.substring(slash + 1));
        }
        int colon = hostPort.indexOf(':');
        String host = colon < 0 ? hostPort : hostPort.substring(0, colon);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Missing host in easy-connect target: " + text);
        }
        builder.host(host);
        if (colon >= 0) {
            builder.port(parseInt("port", hostPort.substring(colon + 1)));
        }

        applyKeyValues(builder, parseKeyValues(kvPart), false);
        return builder.build();
    }

    /**
     * Splits {@code key=value} pairs separated by whitespace. Keys are
     * lower-cased; a value wrapped in single quotes may contain whitespace.
     * Later duplicates replace earlier ones.
     *
     * @param text the key/value text
     * @return the pairs in order of appearance
     */
    static Map<String, String> parseKeyValues(String text) {
        Map<String, String> result = new LinkedHashMap<>();
        int pos = 0;
        int len = text.length();

        while (pos < len) {
            while (pos < len && Character.isWhitespace(text.charAt(pos))) pos++;
            if (pos >= len) break;

            int keyStart = pos;
            while (pos < len && text.charAt(pos) != '=' && !Character.isWhitespace(text.charAt(pos))) pos++;
            String key = text.substring(keyStart, pos);
            if (key.isEmpty()) {
                pos++;
                continue;
            }

            while (pos < len && Character.isWhitespace(text.charAt(pos))) pos++;
            if (pos >= len || text.charAt(pos) != '=') {
                logger.warn("Ignoring attach option without a value: {}", key);
                continue;
            }
            pos++;
            while (pos < len && Character.isWhitespace(text.charAt(pos))) pos++;

            String value;
            if (pos < len && text.charAt(pos) == '\'') {
                pos++;
                int valueStart = pos;
                while (pos < len && text.charAt(pos) != '\'') pos++;
                value = text.substring(valueStart, pos);
                if (pos < len) pos++;
            } else {
                int valueStart = pos;
                while (pos < len && !Character.isWhitespace(text.charAt(pos))) pos++;
                value = text.substring(valueStart, pos);
            }

            result.put(key.toLowerCase(Locale.ROOT), value);
        }
        return result;
    }

    private static void applyKeyValues(OracleConnectionParameters.Builder builder,
                                       Map<String, String> kv, boolean addressKeys) {
        for (Map.Entry<String, String> entry : kv.entrySet()) {
            String value = entry.getValue();
            switch (entry.getKey()) {
                case "host" -> {
                    if (addressKeys) builder.host(value);
                    else logger.warn("Ignoring host={} outside the key/value form", value);
                }
                case "port" -> {
                    if (addressKeys) builder.port(parseInt("port", value));
                    else logger.warn("Ignoring port={} outside the key/value form", value);
                }
                case "service", "service_name" -> builder.serviceName(value);
                case "sid" -> builder.sid(value);
                case "tns", "alias" -> builder.alias(value);
                case "user", "username" -> builder.user(value);
                case "password" -> builder.password(value);
                case "schema" -> builder.schema(value);
                case "wallet", "wallet_location" -> builder.walletLocation(value);
                case "fetch_size" -> builder.fetchSize(parseInt("fetch_size", value));
                case "read_only" -> builder.readOnly(parseBoolean("read_only", value));
                default -> logger.warn("Ignoring unknown attach option: {}", entry.getKey());
            }
        }
    }

    static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'", e);
        }
    }

    static boolean parseBoolean(String key, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "true", "1", "yes", "on":
                return true;
            case "false", "0", "no", "off":
                return false;
            default:
                throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'");
        }
    }

    private static boolean startsWithWord(String text, String word) {
        return text.length() > word.length()
            && text.regionMatches(true, 0, word, 0, word.length())
            && Character.isWhitespace(text.charAt(word.length()));
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
