package com.pawpal.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A care subject: owns an insertion-ordered list of tasks.
 * Every task in the list reports this pet's id as its {@link Task#subjectId()}.
 */
public final class Pet {

    private final String id;
    private final String name;
    private final String species;
    private final int age;
    private final String specialNeeds;
    private final List<Task> tasks = new ArrayList<>();

    public Pet(String id, String name, String species, int age, String specialNeeds) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pet id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pet name must not be blank");
        }
        if (age < 0) {
            throw new IllegalArgumentException("Pet age must not be negative, got " + age);
        }
        this.id = id;
        this.name = name;
        this.species = species;
        this.age = age;
        this.specialNeeds = specialNeeds != null ? specialNeeds : "";
    }

    public Pet(String id, String name, String species, int age) {
        this(id, name, species, age, "");
    }

    public String id() { return id; }
    public String name() { return name; }
    public String species() { return species; }
    public int age() { return age; }
    public String specialNeeds() { return specialNeeds; }

    /**
     * Appends a task and stamps this pet as its owner.
     *
     * @throws IllegalArgumentException if a task with the same id is already listed
     * @throws IllegalStateException    if the task already belongs to another pet
     */
    public void addTask(Task task) {
        if (tasks.stream().anyMatch(t -> t.id().equals(task.id()))) {
            throw new IllegalArgumentException("Pet " + id + " already has task " + task.id());
        }
        task.assignTo(id);
        tasks.add(task);
    }

    public List<Task> tasks() {
        return Collections.unmodifiableList(tasks);
    }

    public List<Task> incompleteTasks() {
        return tasks.stream().filter(t -> !t.isCompleted()).toList();
    }

    @Override
    public String toString() {
        String needs = specialNeeds.isBlank() ? "" : " (Special needs: " + specialNeeds + ")";
        return name + " - " + species + ", " + age + " years old" + needs;
    }
}
