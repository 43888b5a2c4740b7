package de.bsommerfeld.quizbank.core.util;

import de.bsommerfeld.quizbank.core.domain.NewOption;
import de.bsommerfeld.quizbank.core.domain.NewQuestion;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates sample questions for TEST mode and offline development.
 *
 * <p>
 * Every generated question has between two and five options with exactly
 * one marked correct, at a random position, so consumers see the same shapes
 * production data has. The output is a pure value; nothing is persisted here.
 */
public final class TestDataGenerator {

    private static final String[] SUBJECTS = { "Java", "SQLite", "Guice", "Maven", "JUnit", "SLF4J", "TOML" };

    private static final String[] STEMS = {
            "Which statement about %s is true?",
            "What is %s mostly used for?",
            "Which of these belongs to %s?",
            "Pick the correct fact about %s."
    };

    private static final String[] RIGHT = {
            "It is widely used in production", "It is open source", "It runs on the JVM",
            "It has a stable public API"
    };

    private static final String[] WRONG = {
            "It was released in 1970", "It only runs on mainframes", "It is a spreadsheet format",
            "It cannot be tested", "It requires a GPU", "It replaces the operating system"
    };

    private final Random random;

    public TestDataGenerator() {
        this(new Random());
    }

    public TestDataGenerator(long seed) {
        this(new Random(seed));
    }

    private TestDataGenerator(Random random) {
        this.random = random;
    }

    public List<NewQuestion> generateQuestions(int count) {
        List<NewQuestion> questions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            questions.add(generateQuestion());
        }
        return questions;
    }

    public NewQuestion generateQuestion() {
        String subject = pick(SUBJECTS);
        String body = String.format(pick(STEMS), subject);

        int optionCount = 2 + random.nextInt(4);
        int correctIndex = random.nextInt(optionCount);
        List<NewOption> options = new ArrayList<>(optionCount);
        for (int i = 0; i < optionCount; i++) {
            options.add(i == correctIndex
                    ? new NewOption(pick(RIGHT), true)
                    : new NewOption(pick(WRONG), false));
        }
        return new NewQuestion(body, options);
    }

    private String pick(String[] pool) {
        return pool[random.nextInt(pool.length)];
    }
}
