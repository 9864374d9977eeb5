package timetable.model;

public class Course {
    private final int id; // negative = synthetic placeholder
    private final String name;
    private final String code;
    private final int credits;
    private final String section;
    private final Integer teacherId;

    public Course(int id, String name, String code, int credits, String section, Integer teacherId) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.code = code == null ? "" : code;
        this.credits = Math.max(1, credits);
        this.section = section == null ? "" : section;
        this.teacherId = teacherId;
    }

    public Course(int id, String name, int credits) {
        this(id, name, null, credits, null, null);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCode() {
        return code;
    }

    public int getCredits() {
        return credits;
    }

    public String getSection() {
        return section;
    }

    public Integer getTeacherId() {
        return teacherId;
    }

    /**
     * Text shown in grid cells: name, then code, then "C" + id.
     */
    public String label() {
        String n = name.trim();
        if (!n.isEmpty())
            return n;
        String c = code.trim();
        if (!c.isEmpty())
            return c;
        return "C" + id;
    }

    @Override
    public String toString() {
        return id + ":" + label();
    }
}
