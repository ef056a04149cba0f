package com.pawpal.core.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pawpal.core.config.PawPalProperties;
import com.pawpal.core.input.OwnerDocument.PetDocument;
import com.pawpal.core.input.OwnerDocument.TaskDocument;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Pet;
import com.pawpal.core.model.Recurrence;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TaskCategory;
import com.pawpal.core.model.TimeOfDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validation boundary between caller-supplied JSON and the planning core.
 * <p>
 * Converts text fields into closed enumerations and minute-of-day values and
 * rejects anything out of range with an {@link InvalidInputException} naming
 * the offending task or pet. Defaults that depend on "today" use the reference
 * date passed in, never the system clock.
 */
@Component
public class OwnerDocumentMapper {

    private static final Logger log = LoggerFactory.getLogger(OwnerDocumentMapper.class);

    private final ObjectMapper objectMapper;
    private final PawPalProperties properties;

    public OwnerDocumentMapper(ObjectMapper objectMapper, PawPalProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Owner read(Path file, LocalDate referenceDate) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidInputException("Owner file not found: " + file);
        }
        try {
            log.debug("Reading owner document {}", file);
            return toOwner(objectMapper.readValue(file.toFile(), OwnerDocument.class), referenceDate);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed owner document " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidInputException("Could not read owner document " + file + ": " + e.getMessage(), e);
        }
    }

    public Owner parse(String json, LocalDate referenceDate) {
        try {
            return toOwner(objectMapper.readValue(json, OwnerDocument.class), referenceDate);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed owner document: " + e.getOriginalMessage(), e);
        }
    }

    public Owner toOwner(OwnerDocument doc, LocalDate referenceDate) {
        int budget = doc.availableMinutes() != null
                ? doc.availableMinutes()
                : properties.getDefaultBudgetMinutes();
        if (budget < 0 || budget > properties.getMaxBudgetMinutes()) {
            throw new InvalidInputException("Available time must be between 0 and "
                    + properties.getMaxBudgetMinutes() + " minutes, got " + budget);
        }
        String ownerId = isBlank(doc.id()) ? "OWNER-1" : doc.id();
        var owner = new Owner(ownerId, isBlank(doc.name()) ? ownerId : doc.name(), budget);

        List<PetDocument> pets = doc.pets() != null ? doc.pets() : List.of();
        var taskIds = new HashSet<String>();
        for (int i = 0; i < pets.size(); i++) {
            if (pets.get(i) == null) {
                throw new InvalidInputException("Pet entry " + (i + 1) + " is null");
            }
            Pet pet = toPet(pets.get(i), "PET-" + (i + 1), referenceDate, taskIds);
            if (owner.findPet(pet.id()).isPresent()) {
                throw new InvalidInputException("Duplicate pet id: " + pet.id());
            }
            owner.addPet(pet);
        }
        log.debug("Loaded owner {} with {} pet(s), {} task(s)",
                owner.id(), owner.pets().size(), owner.allTasks().size());
        return owner;
    }

    private Pet toPet(PetDocument doc, String fallbackId, LocalDate referenceDate, Set<String> taskIds) {
        if (isBlank(doc.name())) {
            throw new InvalidInputException("Pet " + fallbackId + " has no name");
        }
        int age = doc.age() != null ? doc.age() : 0;
        if (age < 0) {
            throw new InvalidInputException("Pet '" + doc.name() + "' has negative age " + age);
        }
        String petId = isBlank(doc.id()) ? fallbackId : doc.id();
        var pet = new Pet(petId, doc.name(), isBlank(doc.species()) ? "Other" : doc.species(),
                age, doc.specialNeeds());

        List<TaskDocument> tasks = doc.tasks() != null ? doc.tasks() : List.of();
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i) == null) {
                throw new InvalidInputException("Pet '" + doc.name() + "': task entry " + (i + 1) + " is null");
            }
            Task task = toTask(tasks.get(i), petId + "-TASK-" + (i + 1), referenceDate);
            // ids must be unique across the whole owner, not just this pet
            if (!taskIds.add(task.id())) {
                throw new InvalidInputException("Duplicate task id: " + task.id());
            }
            pet.addTask(task);
        }
        return pet;
    }

    Task toTask(TaskDocument doc, String fallbackId, LocalDate referenceDate) {
        String label = isBlank(doc.name()) ? fallbackId : "'" + doc.name() + "'";
        if (isBlank(doc.name())) {
            throw new InvalidInputException("Task " + fallbackId + " has no name");
        }
        TaskCategory category = TaskCategory.fromLabel(doc.category())
                .orElseThrow(() -> new InvalidInputException(
                        "Task " + label + " has unknown category: " + doc.category()));
        if (doc.durationMinutes() == null || doc.durationMinutes() <= 0) {
            throw new InvalidInputException("Task " + label + " needs a positive duration, got "
                    + doc.durationMinutes());
        }
        if (doc.priority() == null || doc.priority() < Task.MIN_PRIORITY || doc.priority() > Task.MAX_PRIORITY) {
            throw new InvalidInputException("Task " + label + " needs a priority between 1 and 5, got "
                    + doc.priority());
        }
        Recurrence recurrence = isBlank(doc.frequency())
                ? Recurrence.DAILY
                : Recurrence.parse(doc.frequency()).orElseThrow(() -> new InvalidInputException(
                        "Task " + label + " has unknown frequency: " + doc.frequency()));

        Integer scheduledTime = null;
        if (!isBlank(doc.scheduledTime())) {
            try {
                scheduledTime = TimeOfDay.parse(doc.scheduledTime());
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Task " + label + ": " + e.getMessage(), e);
            }
        }

        LocalDate dueDate = referenceDate;
        if (!isBlank(doc.dueDate())) {
            try {
                dueDate = LocalDate.parse(doc.dueDate().trim());
            } catch (DateTimeParseException e) {
                throw new InvalidInputException("Task " + label + " has malformed due date: " + doc.dueDate(), e);
            }
        }

        String id = isBlank(doc.id()) ? fallbackId : doc.id();
        return new Task(id, doc.name(), category, doc.durationMinutes(), doc.priority(),
                recurrence, scheduledTime, dueDate, Boolean.TRUE.equals(doc.completed()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
