package com.homepurse.analysis.agent;

import com.homepurse.analysis.ai.OpenAiResponsesClient;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the generation and repair prompts. Pure: the same inputs always give the same messages.
 */
@Component
public class PromptComposer {

    private static final String EXAMPLE_VIEW = ScopedViewCatalog.HOUSEHOLD_EXPENSES.name();

    private final QuestionContextResolver resolver;

    public PromptComposer() {
        this(new QuestionContextResolver());
    }

    PromptComposer(QuestionContextResolver resolver) {
        this.resolver = resolver;
    }

    public PromptPayload generation(String question, SchemaContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Question: ").append(question.strip());
        appendResolvedHints(sb, question, context);
        return new PromptPayload(PromptPayload.Kind.GENERATION, List.of(
                new OpenAiResponsesClient.Message("system", systemPrompt(context)),
                new OpenAiResponsesClient.Message("user", sb.toString())
        ));
    }

    /**
     * The failure reason is passed through unchanged so the model sees the literal validator or
     * database message.
     */
    public PromptPayload repair(String question, SchemaContext context, String failedSql, String failureReason) {
        StringBuilder sb = new StringBuilder();
        sb.append("The previous SQL for this question failed. Return a corrected query.\n");
        sb.append("Question: ").append(question.strip());
        appendResolvedHints(sb, question, context);
        sb.append("\n");
        sb.append("Failed SQL:\n");
        sb.append(failedSql == null || failedSql.isBlank() ? "(no SQL was produced)" : failedSql).append("\n");
        sb.append("Failure reason:\n");
        sb.append(failureReason == null ? "" : failureReason).append("\n");
        sb.append("Fix the cause named in the failure reason and follow every rule above. ");
        sb.append("Answer with compact JSON only: {\"sql\": \"...\", \"reason\": \"...\"}.");
        return new PromptPayload(PromptPayload.Kind.REPAIR, List.of(
                new OpenAiResponsesClient.Message("system", systemPrompt(context)),
                new OpenAiResponsesClient.Message("user", sb.toString())
        ));
    }

    String systemPrompt(SchemaContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You translate questions about one household's spending into a single PostgreSQL query.\n");
        sb.append("Rules:\n");
        sb.append("- Write exactly one read-only SELECT statement. WITH ... SELECT is allowed.\n");
        sb.append("- Never write INSERT, UPDATE, DELETE, DDL, locking clauses or SELECT INTO.\n");
        sb.append("- Do not end the query with a semicolon and do not include more than one statement.\n");
        sb.append("- Only use the relations listed under Schema. Do not qualify them with a schema name.\n");
        sb.append("- Rows are already limited to this household. Do not filter by household.\n");
        sb.append("- Do not call system, catalog, session or file functions.\n");
        sb.append("- Add a LIMIT when returning individual rows.\n");
        sb.append("- Do not write SQL comments.\n");
        sb.append("- Give result columns short snake_case aliases.\n");
        if (context.allows(EXAMPLE_VIEW)) {
            sb.append("- Unless the question asks about drafts, only count rows with status = 'confirmed'.\n");
        }
        sb.append("Reference date (today): ").append(DateTimeFormatter.ISO_LOCAL_DATE.format(context.referenceDate())).append("\n");
        sb.append("Schema:\n");
        for (SchemaContext.ViewSchema view : context.views()) {
            sb.append("- ").append(view.name()).append("(");
            for (int i = 0; i < view.columns().size(); i++) {
                SchemaContext.Column column = view.columns().get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(column.name()).append(" ").append(column.type());
            }
            sb.append(")");
            if (view.description() != null && !view.description().isBlank()) {
                sb.append(": ").append(view.description());
            }
            sb.append("\n");
        }
        SchemaContext.HouseholdHints hints = context.hints();
        if (!hints.isEmpty()) {
            sb.append("Known values in this household:\n");
            appendHint(sb, "categories", hints.categories());
            appendHint(sb, "subcategories", hints.subcategories());
            appendHint(sb, "members (logged_by)", hints.members());
            appendHint(sb, "merchants or items", hints.merchants());
        }
        if (context.allows(EXAMPLE_VIEW)) {
            sb.append("Examples:\n");
            appendExample(sb, "How much did we spend this month?",
                    "SELECT COALESCE(SUM(amount), 0) AS total_spent FROM household_expenses "
                            + "WHERE status = 'confirmed' AND date_incurred >= date_trunc('month', CURRENT_DATE)");
            appendExample(sb, "What are our top 5 categories in the last 90 days?",
                    "SELECT category, SUM(amount) AS total_spent FROM household_expenses "
                            + "WHERE status = 'confirmed' AND date_incurred >= CURRENT_DATE - INTERVAL '90 days' "
                            + "GROUP BY category ORDER BY total_spent DESC LIMIT 5");
            appendExample(sb, "Show monthly spending for the last 6 months",
                    "SELECT to_char(date_trunc('month', date_incurred), 'YYYY-MM') AS month, SUM(amount) AS total_spent "
                            + "FROM household_expenses WHERE status = 'confirmed' "
                            + "AND date_incurred >= date_trunc('month', CURRENT_DATE) - INTERVAL '5 months' "
                            + "GROUP BY 1 ORDER BY 1");
        }
        sb.append("Answer with compact JSON only, no markdown: {\"sql\": \"...\", \"reason\": \"one short sentence\"}.");
        return sb.toString();
    }

    private void appendResolvedHints(StringBuilder sb, String question, SchemaContext context) {
        List<String> resolved = resolver.resolve(question, context);
        if (resolved.isEmpty()) {
            return;
        }
        sb.append("\nResolved context hints:");
        for (String hint : resolved) {
            sb.append("\n- ").append(hint);
        }
    }

    private static void appendHint(StringBuilder sb, String label, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        sb.append("- ").append(label).append(": ").append(String.join(", ", values)).append("\n");
    }

    private static void appendExample(StringBuilder sb, String question, String sql) {
        sb.append("Q: ").append(question).append("\n");
        sb.append("{\"sql\": \"").append(sql.replace("\"", "\\\"")).append("\", \"reason\": \"...\"}\n");
    }
}
