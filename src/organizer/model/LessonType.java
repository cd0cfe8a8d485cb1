package organizer.model;

/**
 * Lesson categories offered by the club.
 * Codes are used by the client questionnaire, do not renumber them.
 */
public enum LessonType {
    CELLULITE_KILLER(0),
    ZUMBA(1),
    ZUMBA_ADVANCED(2),
    FITNESS(3),
    CROSSFIT(4),
    BRAZILIAN_BUTT(5),
    PILATES(6),
    CITY_PUMP(7),
    STRETCHING(8),
    YOGA(9);

    private final int code;

    LessonType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return name().replace('_', ' ');
    }

    public static LessonType fromCode(int code) {
        for (LessonType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lesson type code: " + code);
    }
}
