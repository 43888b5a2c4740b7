package de.bsommerfeld.quizbank.db;

import de.bsommerfeld.quizbank.core.domain.NewOption;
import de.bsommerfeld.quizbank.core.domain.NewQuestion;
import de.bsommerfeld.quizbank.core.domain.Option;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.core.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the in-memory TestDatabaseService used during TEST mode.
 */
class TestDatabaseServiceTest {

    private TestDatabaseService db;

    @BeforeEach
    void setUp() {
        db = new TestDatabaseService();
    }

    @Test
    void constructor_shouldPreSeedQuestions() {
        assertEquals(TestDatabaseService.SEED_QUESTIONS, db.countQuestions());
        assertEquals(TestDatabaseService.SEED_QUESTIONS, db.getAllQuestions().size());
    }

    @Test
    void createQuestion_shouldRoundTripInOrder() {
        long id = db.createQuestion(new NewQuestion("a",
                List.of(new NewOption("b", true), new NewOption("c", false))));

        Question q = db.getQuestion(id);
        assertEquals("a", q.body());
        assertEquals(List.of("b", "c"), q.options().stream().map(Option::body).toList());
        assertTrue(q.options().stream().allMatch(Option::isPersisted));
    }

    @Test
    void updateQuestion_shouldReassignOptionIds() {
        long id = db.createQuestion(new NewQuestion("a", List.of(new NewOption("b", true))));
        Question read = db.getQuestion(id);

        db.updateQuestion(read.withBody("a2"));

        Question updated = db.getQuestion(id);
        assertEquals("a2", updated.body());
        assertNotEquals(read.options().get(0).id(), updated.options().get(0).id());
    }

    @Test
    void deleteQuestion_shouldRemoveIt() {
        long id = db.createQuestion(new NewQuestion("a", List.of()));

        db.deleteQuestion(id);

        assertThrows(NotFoundException.class, () -> db.getQuestion(id));
    }

    @Test
    void missingQuestion_shouldThrowNotFoundForEveryOperation() {
        Question ghost = new Question(10_000, "ghost", List.of());

        assertThrows(NotFoundException.class, () -> db.getQuestion(10_000));
        assertThrows(NotFoundException.class, () -> db.updateQuestion(ghost));
        assertThrows(NotFoundException.class, () -> db.deleteQuestion(ghost));
    }
}
