package com.pawpal.core.input;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pawpal.core.config.PawPalProperties;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Recurrence;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TaskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OwnerDocumentMapperTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    @TempDir
    Path tempDir;

    private OwnerDocumentMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new OwnerDocumentMapper(new ObjectMapper(), new PawPalProperties());
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(OwnerDocumentMapperTest.class.getResource("/owners/" + name).toURI());
    }

    private static String ownerJson(String taskJson) {
        return """
                {"id": "o", "name": "Jordan", "available_minutes": 90,
                 "pets": [{"id": "max", "name": "Max", "species": "Dog", "age": 3,
                           "tasks": [%s]}]}
                """.formatted(taskJson);
    }

    @Test
    @DisplayName("reads the household fixture with pets, tasks and completion flags")
    void readsFixture() throws Exception {
        Owner owner = mapper.read(fixture("household.json"), TODAY);

        assertEquals("OWNER-JORDAN", owner.id());
        assertEquals(60, owner.availableMinutes());
        assertEquals(List.of("Max", "Luna"), owner.pets().stream().map(p -> p.name()).toList());
        assertEquals(5, owner.allTasks().size());
        assertEquals("Thyroid medication", owner.findPet("luna").orElseThrow().specialNeeds());

        Task walk = owner.findTask("max-walk").orElseThrow();
        assertEquals(TaskCategory.WALK, walk.category());
        assertEquals(Recurrence.DAILY, walk.recurrence());
        assertEquals(420, walk.scheduledTime().getAsInt());
        assertEquals(LocalDate.of(2026, 2, 15), walk.dueDate());
        assertEquals("max", walk.subjectId().orElseThrow());

        Task vet = owner.findTask("max-vet").orElseThrow();
        assertTrue(vet.isCompleted());
        assertFalse(vet.isScheduled());
        assertEquals("max", vet.subjectId().orElseThrow());
        // loading a completed recurring task must not spawn a successor
        assertEquals(3, owner.findPet("max").orElseThrow().tasks().size());
        assertTrue(vet.complete().isEmpty());
    }

    @Test
    @DisplayName("applies defaults: budget, ids, daily frequency and reference due date")
    void defaults() {
        Owner owner = mapper.parse("""
                {"name": "Sam",
                 "pets": [{"name": "Rex", "tasks": [
                    {"name": "Walk", "category": "walk", "duration_minutes": 20, "priority": 3}]}]}
                """, TODAY);

        assertEquals(120, owner.availableMinutes());
        assertEquals("OWNER-1", owner.id());
        Task walk = owner.allTasks().get(0);
        assertEquals("PET-1-TASK-1", walk.id());
        assertEquals("PET-1", walk.subjectId().orElseThrow());
        assertEquals(Recurrence.DAILY, walk.recurrence());
        assertEquals(TODAY, walk.dueDate());
        assertFalse(walk.isScheduled());
        assertEquals("Other", owner.pets().get(0).species());
    }

    @Test
    @DisplayName("reads from a file written to disk")
    void readsFile() throws IOException {
        Path file = tempDir.resolve("owner.json");
        Files.writeString(file, ownerJson("""
                {"name": "Feed", "category": "feeding", "duration_minutes": 10, "priority": 5,
                 "frequency": "once", "scheduled_time": "8:05"}"""));

        Owner owner = mapper.read(file, TODAY);

        Task feed = owner.allTasks().get(0);
        assertEquals(Recurrence.NONE, feed.recurrence());
        assertEquals(485, feed.scheduledTime().getAsInt());
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        private void assertRejected(String taskJson, String messagePart) {
            var e = assertThrows(InvalidInputException.class, () -> mapper.parse(ownerJson(taskJson), TODAY));
            assertTrue(e.getMessage().contains(messagePart), e.getMessage());
        }

        @Test
        @DisplayName("malformed time of day")
        void malformedTime() {
            assertRejected("""
                    {"name": "Walk", "category": "walk", "duration_minutes": 20, "priority": 3,
                     "scheduled_time": "25:00"}""", "'Walk'");
        }

        @Test
        @DisplayName("priority outside 1..5")
        void badPriority() {
            assertRejected("""
                    {"name": "Walk", "category": "walk", "duration_minutes": 20, "priority": 9}""",
                    "priority between 1 and 5");
        }

        @Test
        @DisplayName("non-positive or missing duration")
        void badDuration() {
            assertRejected("""
                    {"name": "Walk", "category": "walk", "duration_minutes": -5, "priority": 3}""",
                    "positive duration");
            assertRejected("""
                    {"name": "Walk", "category": "walk", "priority": 3}""", "positive duration");
        }

        @Test
        @DisplayName("unknown category and frequency")
        void unknownEnums() {
            assertRejected("""
                    {"name": "Nap", "category": "sleeping", "duration_minutes": 20, "priority": 3}""",
                    "unknown category");
            assertRejected("""
                    {"name": "Walk", "category": "walk", "duration_minutes": 20, "priority": 3,
                     "frequency": "monthly"}""", "unknown frequency");
        }

        @Test
        @DisplayName("malformed due date")
        void badDueDate() {
            assertRejected("""
                    {"name": "Walk", "category": "walk", "duration_minutes": 20, "priority": 3,
                     "due_date": "15/02/2026"}""", "malformed due date");
        }

        @Test
        @DisplayName("duplicate task ids")
        void duplicateIds() {
            assertRejected("""
                    {"id": "t", "name": "A", "category": "walk", "duration_minutes": 20, "priority": 3},
                    {"id": "t", "name": "B", "category": "walk", "duration_minutes": 20, "priority": 3}""",
                    "Duplicate task id");
        }

        @Test
        @DisplayName("budget above the configured maximum")
        void budgetTooLarge() {
            var e = assertThrows(InvalidInputException.class, () ->
                    mapper.parse("{\"available_minutes\": 600, \"pets\": []}", TODAY));
            assertTrue(e.getMessage().contains("between 0 and 480"));
        }

        @Test
        @DisplayName("duplicate task ids across pets")
        void duplicateIdsAcrossPets() {
            var e = assertThrows(InvalidInputException.class, () -> mapper.parse("""
                    {"pets": [
                      {"name": "Rex", "tasks": [{"id": "t", "name": "A", "category": "walk", "duration_minutes": 20, "priority": 3}]},
                      {"name": "Tom", "tasks": [{"id": "t", "name": "B", "category": "feeding", "duration_minutes": 5, "priority": 3}]}]}
                    """, TODAY));
            assertTrue(e.getMessage().contains("Duplicate task id: t"), e.getMessage());
        }

        @Test
        @DisplayName("null pet and task entries are named by position")
        void nullEntries() {
            assertRejected("null", "task entry 1 is null");

            var e = assertThrows(InvalidInputException.class, () -> mapper.parse("""
                    {"pets": [{"name": "Rex", "tasks": []}, null]}
                    """, TODAY));
            assertTrue(e.getMessage().contains("Pet entry 2 is null"), e.getMessage());
        }

        @Test
        @DisplayName("malformed JSON and missing file")
        void unreadable() {
            assertThrows(InvalidInputException.class, () -> mapper.parse("{not json", TODAY));
            assertThrows(InvalidInputException.class, () -> mapper.read(tempDir.resolve("missing.json"), TODAY));
        }
    }
}
