package org.example.learnpath.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "daily_plans",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_plans_course_day", columnNames = {"course_id", "day_number"})
)
public class DailyPlanEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private CourseEntity course;

    @Column(name = "day_number", nullable = false)
    private int dayNumber;

    @Column(name = "content_brief", nullable = false, columnDefinition = "TEXT")
    private String contentBrief;

    public DailyPlanEntity() {
    }

    public DailyPlanEntity(CourseEntity course, int dayNumber, String contentBrief) {
        this.course = course;
        this.dayNumber = dayNumber;
        this.contentBrief = contentBrief;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public CourseEntity getCourse() {
        return course;
    }

    public void setCourse(CourseEntity course) {
        this.course = course;
    }

    public int getDayNumber() {
        return dayNumber;
    }

    public void setDayNumber(int dayNumber) {
        this.dayNumber = dayNumber;
    }

    public String getContentBrief() {
        return contentBrief;
    }

    public void setContentBrief(String contentBrief) {
        this.contentBrief = contentBrief;
    }
}
