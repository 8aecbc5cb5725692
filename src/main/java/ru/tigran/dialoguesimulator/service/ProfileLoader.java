package ru.tigran.dialoguesimulator.service;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.ProfileParseException;
import ru.tigran.dialoguesimulator.model.ProfileSection;
import ru.tigran.dialoguesimulator.model.SubjectProfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Loads subject profiles from {@code <profilesDir>/<profileId>.txt} files.
 *
 * Grammar, one construct per line (leading and trailing blanks ignored):
 * <pre>
 * # comment
 * section:            one of the {@link ProfileSection} headers, no spaces
 * key: value          value coerced: [a, "b"] list, digits integer, true/false boolean, else string
 * - item              appended to the list of the last key in the section
 * </pre>
 * Inside a section a bare {@code name:} line directly followed by {@code - item} lines starts a list.
 * Any other unknown header fails the file.
 */
@Slf4j
public class ProfileLoader {

    private static final String PROFILE_EXTENSION = ".txt";
    // longer digit runs (phone-like ids) stay strings
    private static final int MAX_INTEGER_DIGITS = 9;

    private final Path profilesDir;

    public ProfileLoader(Path profilesDir) {
        this.profilesDir = profilesDir;
    }

    public Path getProfilesDir() {
        return profilesDir;
    }

    /**
     * Lists profile ids (file names without extension), sorted.
     *
     * @throws ConfigurationException if the profiles directory does not exist or cannot be listed
     */
    public List<String> listProfileIds() {
        if (!Files.isDirectory(profilesDir)) {
            throw new ConfigurationException(
                    "Profiles directory not found: " + profilesDir.toAbsolutePath(),
                    ErrorCode.CONFIGURATION_ERROR
            );
        }
        try (Stream<Path> files = Files.list(profilesDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(PROFILE_EXTENSION))
                    .map(name -> name.substring(0, name.length() - PROFILE_EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException(
                    "Cannot list profiles directory " + profilesDir + ": " + e.getMessage(),
                    ErrorCode.CONFIGURATION_ERROR
            );
        }
    }

    /**
     * Loads every profile in the directory, keyed and ordered by id.
     * Files that fail to parse are logged and skipped.
     */
    public Map<String, SubjectProfile> loadAllProfiles() {
        Map<String, SubjectProfile> profiles = new TreeMap<>();
        for (String profileId : listProfileIds()) {
            try {
                profiles.put(profileId, loadProfile(profileId));
            } catch (ProfileParseException e) {
                log.error("Skipping profile {}: {}", profileId, e.getMessage());
            }
        }
        log.info("Loaded {} profiles from {}", profiles.size(), profilesDir);
        return profiles;
    }

    /**
     * Loads one profile by id.
     *
     * @throws ProfileParseException if the file is missing, unreadable or malformed
     */
    public SubjectProfile loadProfile(String profileId) {
        Path file = profilesDir.resolve(profileId + PROFILE_EXTENSION);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProfileParseException("Cannot read profile file " + file + ": " + e.getMessage(), e);
        }
        return SubjectProfile.fromSections(profileId, parse(profileId, content));
    }

    /**
     * Profiles whose id contains the given stance fragment (case-insensitive), ordered by id.
     * "center" also matches "center_left" and "center_right" ids.
     */
    public List<SubjectProfile> getProfilesByStance(String stance) {
        String fragment = stance.toLowerCase(Locale.ROOT);
        List<SubjectProfile> matching = new ArrayList<>();
        loadAllProfiles().forEach((profileId, profile) -> {
            if (profileId.toLowerCase(Locale.ROOT).contains(fragment)) {
                matching.add(profile);
            }
        });
        return matching;
    }

    /**
     * Parses profile text into per-section key/value maps, preserving key order.
     *
     * @param source name used in error messages
     * @param content profile file content
     * @return parsed sections
     * @throws ProfileParseException on an unknown section header or a bare key with no list items
     */
    public static Map<ProfileSection, Map<String, Object>> parse(String source, String content) {
        Map<ProfileSection, Map<String, Object>> sections = new EnumMap<>(ProfileSection.class);
        Map<String, Object> current = null;
        String lastKey = null;

        String[] lines = content.split("\\R");
        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = lines[index].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            if (isHeader(line)) {
                String name = line.substring(0, line.length() - 1);
                var section = ProfileSection.fromHeader(name);
                if (section.isPresent()) {
                    current = sections.computeIfAbsent(section.get(), key -> new LinkedHashMap<>());
                    lastKey = null;
                } else if (current != null && startsListItems(lines, index + 1)) {
                    current.put(name, new ArrayList<>());
                    lastKey = name;
                } else {
                    throw new ProfileParseException(String.format(
                            "%s:%d: unknown section '%s'", source, lineNumber, name));
                }
                continue;
            }

            if (line.startsWith("- ") || line.equals("-")) {
                if (current == null || lastKey == null) {
                    log.warn("{}:{}: list item without a key, ignored", source, lineNumber);
                    continue;
                }
                appendItem(current, lastKey, line.substring(1).strip());
                continue;
            }

            int separator = line.indexOf(':');
            if (separator > 0) {
                if (current == null) {
                    log.warn("{}:{}: key outside any section, ignored", source, lineNumber);
                    continue;
                }
                String key = line.substring(0, separator).strip();
                String value = line.substring(separator + 1).strip();
                current.put(key, value.isEmpty() ? new ArrayList<>() : coerce(value));
                lastKey = key;
                continue;
            }

            log.warn("{}:{}: unrecognized line ignored: {}", source, lineNumber, line);
        }
        return sections;
    }

    /**
     * Coerces a raw scalar: bracketed list, integer, boolean or string.
     */
    static Object coerce(String value) {
        if (value.startsWith("[") && value.endsWith("]")) {
            return parseList(value.substring(1, value.length() - 1));
        }
        if (value.length() <= MAX_INTEGER_DIGITS && value.chars().allMatch(Character::isDigit)) {
            return Integer.parseInt(value);
        }
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        return value;
    }

    private static void appendItem(Map<String, Object> section, String key, String item) {
        Object existing = section.get(key);
        List<Object> items = new ArrayList<>();
        if (existing instanceof List<?> list) {
            items.addAll(list);
        } else if (existing != null) {
            items.add(existing);
        }
        items.add(item);
        section.put(key, items);
    }

    /**
     * Whether the next meaningful line after {@code from} is a {@code - item}.
     */
    private static boolean startsListItems(String[] lines, int from) {
        for (int i = from; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            return line.startsWith("- ") || line.equals("-");
        }
        return false;
    }

    /**
     * Splits a list body on commas outside quotes; quoted items lose their quotes.
     */
    private static List<String> parseList(String body) {
        List<String> items = new ArrayList<>();
        StringBuilder item = new StringBuilder();
        char quote = 0;
        boolean quoted = false;

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    item.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                quoted = true;
            } else if (c == ',') {
                addItem(items, item, quoted);
                item.setLength(0);
                quoted = false;
            } else {
                item.append(c);
            }
        }
        addItem(items, item, quoted);
        return items;
    }

    private static void addItem(List<String> items, StringBuilder item, boolean quoted) {
        String value = item.toString().strip();
        if (quoted || !value.isEmpty()) {
            items.add(value);
        }
    }

    private static boolean isHeader(String line) {
        return line.length() > 1 && line.endsWith(":") && line.indexOf(' ') < 0 && line.indexOf('\t') < 0;
    }
}
