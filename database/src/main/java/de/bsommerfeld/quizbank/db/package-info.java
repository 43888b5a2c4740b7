/**
 * Persistence of questions and their ordered options, SQLite-backed in
 * production and in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Caller]
 *      │
 *      ▼
 *   DatabaseService        ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴──────────┐
 *    │              │
 *  SqlDB          TestDB
 *    │
 *    ▼
 *   QuestionStore          ← owns the transaction of every write
 *    ┌───┴───┐
 *    │       │
 *  Option  Link
 *  Store   Store
 * </pre>
 *
 * {@link de.bsommerfeld.quizbank.db.SchemaManager} creates the tables,
 * {@link de.bsommerfeld.quizbank.db.DatabaseBootstrap} decides whether that
 * is needed and seeds the example question.
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │ options                                                      │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Monotonic, never reused                   │
 * │ body             │ Option text                               │
 * │ correct          │ 0 / 1                                     │
 * └──────────────────┴───────────────────────────────────────────┘
 *
 * ┌──────────────────────────────────────────────────────────────┐
 * │ question_bodies                                              │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ id  (PK)         │ Question id                               │
 * │ body             │ Question text                             │
 * └──────────────────┴───────────────────────────────────────────┘
 *
 * ┌──────────────────────────────────────────────────────────────┐
 * │ questions (link table)                                       │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ question_id (PK) │ FK → question_bodies.id                   │
 * │ option_id   (PK) │ FK → options.id                           │
 * │ option_order     │ 0-based position of the option            │
 * └──────────────────┴───────────────────────────────────────────┘
 *   UNIQUE(option_id, question_id, option_order)
 * </pre>
 *
 * Option and question rows carry no position; order lives only in the link
 * table. Each option row belongs to exactly one question: writes always create
 * fresh option rows, never reuse one. Foreign keys are declared but not
 * enforced, deletes are sequenced by hand (options, links, question body)
 * inside one transaction.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.quizbank.db.SqlLoader}:
 * <ul>
 * <li>{@code insert-question-body.sql}, {@code update-question-body.sql},
 * {@code delete-question-body.sql}</li>
 * <li>{@code select-question-body.sql}, {@code select-all-question-bodies.sql},
 * {@code count-question-bodies.sql}</li>
 * <li>{@code insert-option.sql}, {@code select-option.sql}, {@code select-last-insert-id.sql},
 * {@code delete-option.sql}</li>
 * <li>{@code insert-link.sql}, {@code select-linked-option-ids.sql},
 * {@code delete-links-for-question.sql}, {@code delete-link.sql}</li>
 * </ul>
 */
package de.bsommerfeld.quizbank.db;
