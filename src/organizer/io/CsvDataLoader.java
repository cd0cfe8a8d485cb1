package organizer.io;

import organizer.model.Client;
import organizer.model.Instructor;
import organizer.model.LessonType;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads questionnaire answers and instructor qualifications.
 * <p>
 * Both files use {@code ;} as separator: {@code Client_ID;Lesson_Types} and
 * {@code Instructor_ID;Lesson_Types}, the lesson types being space separated codes,
 * e.g. {@code 7;1 4 9}. A header line and blank lines are skipped.
 */
public class CsvDataLoader {

    /** id and lesson type codes of one line */
    static class RawRecord {
        final int id;
        final List<LessonType> lessonTypes;

        RawRecord(int id, List<LessonType> lessonTypes) {
            this.id = id;
            this.lessonTypes = lessonTypes;
        }
    }

    public static List<Client> loadClients(Path path) throws IOException {
        List<Client> result = new ArrayList<>();
        for (RawRecord r : readRecords(path)) {
            result.add(new Client(r.id, r.lessonTypes));
        }
        System.out.println("Loaded clients: " + result.size());
        return result;
    }

    public static List<Instructor> loadInstructors(Path path) throws IOException {
        List<Instructor> result = new ArrayList<>();
        for (RawRecord r : readRecords(path)) {
            result.add(new Instructor(r.id, r.lessonTypes));
        }
        System.out.println("Loaded instructors: " + result.size());
        return result;
    }

    static List<RawRecord> readRecords(Path path) throws IOException {
        List<RawRecord> out = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            boolean first = true;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String t = stripBom(line).trim();
                if (t.isEmpty()) continue;

                String[] parts = t.split(";", -1);
                String idCell = clean(parts[0]);

                // header like: Client_ID;Lesson_Types
                if (first && !idCell.matches("-?\\d+")) {
                    first = false;
                    continue;
                }
                first = false;

                int id;
                try {
                    id = Integer.parseInt(idCell);
                } catch (NumberFormatException e) {
                    throw new RecordFormatException(path, lineNo, "invalid id '" + idCell + "'");
                }

                List<LessonType> types = new ArrayList<>();
                String typesCell = parts.length > 1 ? clean(parts[1]) : "";
                for (String token : typesCell.split("\\s+")) {
                    if (token.isEmpty()) continue;
                    int code;
                    try {
                        code = Integer.parseInt(token);
                    } catch (NumberFormatException e) {
                        throw new RecordFormatException(path, lineNo, "invalid lesson type '" + token + "'");
                    }
                    try {
                        types.add(LessonType.fromCode(code));
                    } catch (IllegalArgumentException e) {
                        throw new RecordFormatException(path, lineNo, e.getMessage());
                    }
                }
                out.add(new RawRecord(id, types));
            }
        }
        return out;
    }

    private static String stripBom(String s) {
        if (s == null) return null;
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }

    private static String clean(String raw) {
        return stripBom(raw).replace("\"", "").replace("'", "").trim();
    }
}
