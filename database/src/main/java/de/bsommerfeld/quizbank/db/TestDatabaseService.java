package de.bsommerfeld.quizbank.db;

import com.google.inject.Singleton;
import de.bsommerfeld.quizbank.core.domain.NewOption;
import de.bsommerfeld.quizbank.core.domain.NewQuestion;
import de.bsommerfeld.quizbank.core.domain.Option;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.core.error.NotFoundException;
import de.bsommerfeld.quizbank.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite.
 * Bound by Guice when the application runs with {@code app.mode=TEST}.
 *
 * <p>
 * The constructor seeds a handful of questions from {@link TestDataGenerator}.
 * Ids come from two counters that mirror the SQLite autoincrement columns, and
 * updates reassign option ids the same way the SQL store does, so callers see
 * identical identity behaviour in both modes.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    static final int SEED_QUESTIONS = 10;

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    private final NavigableMap<Long, Question> questions = new TreeMap<>();
    private long nextQuestionId = 1;
    private long nextOptionId = 1;

    public TestDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");

        new TestDataGenerator().generateQuestions(SEED_QUESTIONS).forEach(this::createQuestion);
    }

    /**
     * No-op; the in-memory store needs no schema.
     */
    @Override
    public void initialize() {
    }

    @Override
    public synchronized long createQuestion(NewQuestion question) {
        long id = nextQuestionId++;
        List<Option> options = new ArrayList<>(question.options().size());
        for (NewOption option : question.options()) {
            options.add(new Option(nextOptionId++, option.body(), option.correct()));
        }
        questions.put(id, new Question(id, question.body(), options));
        return id;
    }

    @Override
    public synchronized Question getQuestion(long id) {
        Question question = questions.get(id);
        if (question == null) {
            throw new NotFoundException("Question", id);
        }
        return question;
    }

    @Override
    public synchronized List<Question> getAllQuestions() {
        return new ArrayList<>(questions.values());
    }

    @Override
    public synchronized void updateQuestion(Question question) {
        if (!questions.containsKey(question.id())) {
            throw new NotFoundException("Question", question.id());
        }
        List<Option> replaced = new ArrayList<>(question.options().size());
        for (Option option : question.options()) {
            replaced.add(new Option(nextOptionId++, option.body(), option.correct()));
        }
        questions.put(question.id(), new Question(question.id(), question.body(), replaced));
    }

    @Override
    public synchronized void deleteQuestion(Question question) {
        if (questions.remove(question.id()) == null) {
            throw new NotFoundException("Question", question.id());
        }
    }

    @Override
    public synchronized int countQuestions() {
        return questions.size();
    }
}
