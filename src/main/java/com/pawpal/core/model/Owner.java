package com.pawpal.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Top-level aggregate: a daily time budget and the pets whose tasks compete for it.
 */
public final class Owner {

    private final String id;
    private final String name;
    private final int availableMinutes;
    private final List<Pet> pets = new ArrayList<>();

    public Owner(String id, String name, int availableMinutes) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
        if (availableMinutes < 0) {
            throw new IllegalArgumentException("Available time must not be negative, got " + availableMinutes);
        }
        this.id = id;
        this.name = name;
        this.availableMinutes = availableMinutes;
    }

    public String id() { return id; }
    public String name() { return name; }
    public int availableMinutes() { return availableMinutes; }

    public void addPet(Pet pet) {
        if (findPet(pet.id()).isPresent()) {
            throw new IllegalArgumentException("Duplicate pet id: " + pet.id());
        }
        pets.add(pet);
    }

    public List<Pet> pets() {
        return Collections.unmodifiableList(pets);
    }

    public Optional<Pet> findPet(String petId) {
        return pets.stream().filter(p -> p.id().equals(petId)).findFirst();
    }

    /** Display name for a pet id, falling back to the id itself. */
    public String subjectName(String petId) {
        return findPet(petId).map(Pet::name).orElse(petId);
    }

    /** All tasks of all pets, pet order then insertion order. */
    public List<Task> allTasks() {
        var all = new ArrayList<Task>();
        for (Pet pet : pets) {
            all.addAll(pet.tasks());
        }
        return all;
    }

    public List<Task> incompleteTasks() {
        return allTasks().stream().filter(t -> !t.isCompleted()).toList();
    }

    public Optional<Task> findTask(String taskId) {
        return allTasks().stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    /**
     * Looks up the pet by id and appends the task to it.
     *
     * @throws IllegalArgumentException if no pet with that id belongs to this owner,
     *                                  or any of its pets already lists a task with the same id
     */
    public void appendTask(String petId, Task task) {
        Pet pet = findPet(petId)
                .orElseThrow(() -> new IllegalArgumentException("Owner " + id + " has no pet " + petId));
        if (findTask(task.id()).isPresent()) {
            throw new IllegalArgumentException("Owner " + id + " already has task " + task.id());
        }
        pet.addTask(task);
    }

    @Override
    public String toString() {
        int count = pets.size();
        return name + " - " + availableMinutes + " min available, " + count + (count == 1 ? " pet" : " pets");
    }
}
