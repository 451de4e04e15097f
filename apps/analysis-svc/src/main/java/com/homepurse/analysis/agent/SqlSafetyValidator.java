package com.homepurse.analysis.agent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Distinct;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.springframework.stereotype.Component;

/**
 * Decides whether a generated query may run. Checks run in a fixed order and the first failing
 * check names the rejection. Deterministic and free of I/O.
 */
@Component
public class SqlSafetyValidator {

    private static final Pattern SELECT_KEYWORD = Pattern.compile("\\bselect\\b", Pattern.CASE_INSENSITIVE);

    public ValidationResult validate(String sql, Set<String> allowedTables) {
        if (sql == null || sql.isBlank()) {
            return ValidationResult.reject("Unparsable SQL: the query is empty");
        }
        Set<String> allowed = lowerCase(allowedTables);

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException ex) {
            if (looksLikeMultipleStatements(sql)) {
                return ValidationResult.reject("Multiple statements are not allowed; return a single SELECT");
            }
            return ValidationResult.reject("Unparsable SQL: " + firstLine(ex));
        }

        if (!(statement instanceof Select select)) {
            return ValidationResult.reject("Only SELECT statements are allowed, got "
                    + statement.getClass().getSimpleName().toUpperCase(Locale.ROOT));
        }

        RelationCollector whole;
        try {
            whole = RelationCollector.walk(select);
        } catch (UnsupportedOperationException ex) {
            return ValidationResult.reject("Unsupported SQL construct: " + ex.getMessage());
        }
        if (whole.writesData) {
            return ValidationResult.reject("Only read-only SELECT statements are allowed; found " + whole.writeKind);
        }

        if (sql.indexOf(';') >= 0) {
            return ValidationResult.reject("Semicolons are not allowed; return a single statement without ';'");
        }

        int written = countSelectKeywords(sql);
        if (written > whole.selects.size()) {
            return ValidationResult.reject("Could not check every subquery (" + written + " SELECT keywords, "
                    + whole.selects.size() + " checked); keep subqueries in FROM, JOIN, WHERE or the select list"
                    + " and do not use the word SELECT in comments or literals");
        }

        Optional<String> relationProblem = checkRelations(select, whole, allowed);
        if (relationProblem.isPresent()) {
            return ValidationResult.reject(relationProblem.get());
        }

        Optional<String> functionProblem = checkFunctions(whole);
        if (functionProblem.isPresent()) {
            return ValidationResult.reject(functionProblem.get());
        }

        Optional<String> rawProblem = SqlDenyList.scanRawText(sql);
        if (rawProblem.isPresent()) {
            return ValidationResult.reject(rawProblem.get());
        }

        Set<String> referenced = new LinkedHashSet<>();
        Set<String> cteNames = topLevelCteNames(select);
        for (Table table : whole.relations) {
            String name = qualifiedName(table);
            if (!cteNames.contains(name)) {
                referenced.add(name);
            }
        }
        return ValidationResult.accept(referenced);
    }

    /**
     * Top-level CTEs are visible to the main query and to later CTEs only. CTEs declared inside
     * subqueries are not honored as relation names.
     */
    private Optional<String> checkRelations(Select select, RelationCollector whole, Set<String> allowed) {
        if (whole.tableFunction != null) {
            return Optional.of("Table functions are not allowed in FROM: " + whole.tableFunction);
        }
        List<WithItem> withItems = select.getWithItemsList() == null ? List.of() : select.getWithItemsList();
        Set<String> visible = new HashSet<>(allowed);
        for (WithItem withItem : withItems) {
            String cteName = unquote(withItem.getAlias().getName());
            Set<String> visibleInBody = new HashSet<>(visible);
            if (withItem.isRecursive()) {
                visibleInBody.add(cteName);
            }
            RelationCollector body = RelationCollector.walk(withItem.getSelect());
            Optional<String> problem = firstDisallowed(body.relations, visibleInBody, whole.nestedCteNames);
            if (problem.isPresent()) {
                return problem;
            }
            visible.add(cteName);
        }
        return firstDisallowed(whole.relations, visible, whole.nestedCteNames);
    }

    private Optional<String> firstDisallowed(List<Table> relations, Set<String> visible, Set<String> nestedCteNames) {
        for (Table table : relations) {
            String name = qualifiedName(table);
            if (visible.contains(name)) {
                continue;
            }
            if (nestedCteNames.contains(name)) {
                return Optional.of("WITH clauses are only allowed at the top of the query; move '" + name + "' up");
            }
            return Optional.of("Relation '" + name + "' is not allowed; use only: " + String.join(", ", sorted(visible)));
        }
        return Optional.empty();
    }

    private Optional<String> checkFunctions(RelationCollector whole) {
        for (String rawName : whole.functions) {
            String[] parts = rawName.split("\\.");
            for (int i = 0; i < parts.length - 1; i++) {
                if (SqlDenyList.isDeniedSchema(unquote(parts[i]))) {
                    return Optional.of("Access to schema '" + unquote(parts[i]) + "' is not allowed");
                }
            }
            String name = unquote(parts[parts.length - 1]);
            if (SqlDenyList.isDeniedFunction(name)) {
                return Optional.of("Function '" + name + "' is not allowed");
            }
        }
        return Optional.empty();
    }

    private static Set<String> topLevelCteNames(Select select) {
        Set<String> names = new HashSet<>();
        if (select.getWithItemsList() != null) {
            for (WithItem withItem : select.getWithItemsList()) {
                names.add(unquote(withItem.getAlias().getName()));
            }
        }
        return names;
    }

    /**
     * Every query block starts with its own SELECT keyword, so a walk that saw fewer blocks than the
     * text contains has skipped some. Literals and comments are counted too, which only over-rejects.
     */
    static int countSelectKeywords(String sql) {
        Matcher matcher = SELECT_KEYWORD.matcher(sql);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean looksLikeMultipleStatements(String sql) {
        int semicolon = sql.indexOf(';');
        return semicolon >= 0 && !sql.substring(semicolon + 1).replace(";", "").isBlank();
    }

    private static String firstLine(JSQLParserException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        String message = cause.getMessage() != null ? cause.getMessage() : ex.getMessage();
        if (message == null) {
            return "syntax error";
        }
        String line = message.strip().lines().findFirst().orElse("syntax error");
        return line.length() > 300 ? line.substring(0, 300) : line;
    }

    static String qualifiedName(Table table) {
        String[] parts = table.getFullyQualifiedName().split("\\.");
        List<String> cleaned = new ArrayList<>(parts.length);
        for (String part : parts) {
            cleaned.add(unquote(part));
        }
        return String.join(".", cleaned);
    }

    static String unquote(String identifier) {
        String value = identifier.strip();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                value = value.substring(1, value.length() - 1);
            }
        }
        return value.toLowerCase(Locale.ROOT);
    }

    private static Set<String> lowerCase(Set<String> names) {
        Set<String> result = new HashSet<>();
        if (names != null) {
            names.forEach(name -> result.add(name.strip().toLowerCase(Locale.ROOT)));
        }
        return result;
    }

    private static List<String> sorted(Set<String> names) {
        return names.stream().sorted().toList();
    }

    /**
     * Records every relation node, function name and nested CTE name of a statement, and whether
     * any part of it writes data.
     */
    static final class RelationCollector extends TablesNamesFinder {

        private final List<Table> relations = new ArrayList<>();
        private final List<String> functions = new ArrayList<>();
        private final Set<String> nestedCteNames = new HashSet<>();
        private final Set<PlainSelect> selects = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean writesData;
        private String writeKind;
        private String tableFunction;

        static RelationCollector walk(Select select) {
            RelationCollector collector = new RelationCollector();
            collector.getTables((Statement) select);
            if (select.getWithItemsList() != null) {
                for (WithItem withItem : select.getWithItemsList()) {
                    collector.nestedCteNames.remove(unquote(withItem.getAlias().getName()));
                }
            }
            return collector;
        }

        @Override
        public void visit(Table table) {
            relations.add(table);
        }

        @Override
        public void visit(WithItem withItem) {
            if (withItem.getAlias() != null) {
                nestedCteNames.add(unquote(withItem.getAlias().getName()));
            }
            super.visit(withItem);
        }

        @Override
        public void visit(Function function) {
            if (function.getName() != null) {
                functions.add(function.getName());
            }
            super.visit(function);
        }

        @Override
        public void visit(AnalyticExpression analytic) {
            if (analytic.getName() != null) {
                functions.add(analytic.getName());
            }
            super.visit(analytic);
            walk(analytic.getExpression());
            walk(analytic.getOffset());
            walk(analytic.getDefaultValue());
            walk(analytic.getFilterExpression());
            walkAll(analytic.getPartitionExpressionList());
            walkOrderBy(analytic.getOrderByElements());
        }

        @Override
        public void visit(IsNullExpression isNull) {
            super.visit(isNull);
            walk(isNull.getLeftExpression());
        }

        @Override
        public void visit(TableFunction function) {
            tableFunction = function.getFunction() != null ? function.getFunction().getName() : "unknown";
            if (function.getFunction() != null) {
                functions.add(function.getFunction().getName());
            }
        }

        @Override
        public void visit(PlainSelect plainSelect) {
            if (plainSelect.getIntoTables() != null && !plainSelect.getIntoTables().isEmpty()) {
                markWrite("SELECT INTO");
            }
            selects.add(plainSelect);
            super.visit(plainSelect);
            // clauses the base finder does not descend into
            if (plainSelect.getGroupBy() != null) {
                walkAll(plainSelect.getGroupBy().getGroupByExpressionList());
            }
            Distinct distinct = plainSelect.getDistinct();
            if (distinct != null && distinct.getOnSelectItems() != null) {
                for (SelectItem<?> item : distinct.getOnSelectItems()) {
                    walk(item.getExpression());
                }
            }
            walk(plainSelect.getQualify());
            walkTail(plainSelect);
        }

        @Override
        public void visit(SetOperationList setOperations) {
            super.visit(setOperations);
            walkTail(setOperations);
        }

        @Override
        public void visit(ParenthesedSelect parenthesed) {
            super.visit(parenthesed);
            walkTail(parenthesed);
        }

        private void walkTail(Select select) {
            walkOrderBy(select.getOrderByElements());
            Limit limit = select.getLimit();
            if (limit != null) {
                walk(limit.getRowCount());
                walk(limit.getOffset());
                walkAll(limit.getByExpressions());
            }
            if (select.getOffset() != null) {
                walk(select.getOffset().getOffset());
            }
            if (select.getFetch() != null) {
                walk(select.getFetch().getExpression());
            }
        }

        private void walk(Expression expression) {
            if (expression != null) {
                expression.accept(this);
            }
        }

        private void walkAll(Collection<?> expressions) {
            if (expressions == null) {
                return;
            }
            for (Object expression : expressions) {
                if (expression instanceof Expression e) {
                    walk(e);
                }
            }
        }

        private void walkOrderBy(List<OrderByElement> elements) {
            if (elements == null) {
                return;
            }
            for (OrderByElement element : elements) {
                walk(element.getExpression());
            }
        }

        @Override
        public void visit(Insert insert) {
            markWrite("INSERT");
            super.visit(insert);
        }

        @Override
        public void visit(Update update) {
            markWrite("UPDATE");
            super.visit(update);
        }

        @Override
        public void visit(Delete delete) {
            markWrite("DELETE");
            super.visit(delete);
        }

        private void markWrite(String kind) {
            if (!writesData) {
                writesData = true;
                writeKind = kind;
            }
        }
    }
}
