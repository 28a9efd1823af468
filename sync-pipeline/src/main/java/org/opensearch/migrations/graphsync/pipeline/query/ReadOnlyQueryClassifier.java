package org.opensearch.migrations.graphsync.pipeline.query;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.opensearch.migrations.graphsync.pipeline.query.CypherTokenizer.Token;
import org.opensearch.migrations.graphsync.pipeline.query.CypherTokenizer.TokenType;

/**
 * Decides whether a Cypher query is read-only by scanning its clause keywords.
 *
 * Words inside string literals, quoted identifiers and comments are never keywords. A word right after
 * {@code .}, {@code :} or {@code $} is a property, label/type or parameter name and is not a keyword
 * either, except inside the procedure name of a {@code CALL}, where {@code apoc.create.node} counts as a
 * write. Map keys that spell a write keyword ({@code {set: 1}}) are rejected: a false positive is
 * acceptable, a write query slipping through is not.
 */
public final class ReadOnlyQueryClassifier {

    static final Set<String> WRITE_KEYWORDS = Set.of(
        "CREATE", "MERGE", "SET", "DELETE", "REMOVE", "DETACH", "DROP", "FOREACH",
        "GRANT", "REVOKE", "DENY", "ALTER", "TRUNCATE"
    );
    /** Procedures that run Cypher handed to them as a string, which this scan cannot see into. */
    static final List<String> DYNAMIC_CYPHER_PROCEDURE_PREFIXES = List.of(
        "apoc.cypher.", "apoc.periodic.", "periodic."
    );
    static final Set<String> READ_KEYWORDS = Set.of("MATCH", "RETURN");

    public record Classification(boolean allowed, String reason) {
        public static Classification readOnly() {
            return new Classification(true, null);
        }

        public static Classification rejected(String reason) {
            return new Classification(false, reason);
        }
    }

    private ReadOnlyQueryClassifier() {}

    public static Classification classify(String text) {
        if (text == null || text.isBlank()) {
            return Classification.rejected("Query text is empty");
        }

        List<Token> tokens;
        try {
            tokens = CypherTokenizer.tokenize(text);
        } catch (CypherTokenizer.TokenizationException e) {
            return Classification.rejected("Query cannot be parsed: " + e.getMessage());
        }

        boolean hasReadClause = false;
        StringBuilder procedureName = null;
        for (var token : tokens) {
            if (procedureName != null) {
                if (token.type() == TokenType.WORD && isWriteKeyword(token)) {
                    return Classification.rejected(
                        "Query calls a procedure that may write ('" + token.text() + "' in its name)");
                }
                if (token.type() == TokenType.WORD || token.isSymbol('.')) {
                    procedureName.append(token.text());
                    continue;
                }
                var rejection = checkProcedure(procedureName.toString());
                if (rejection != null) {
                    return rejection;
                }
                procedureName = null;
            }
            if (token.type() != TokenType.WORD || isQualifiedName(token)) {
                continue;
            }
            if (isWriteKeyword(token)) {
                return Classification.rejected("Query contains write operation '"
                    + token.text().toUpperCase(Locale.ROOT)
                    + "'. Only read-only queries (MATCH, RETURN, WHERE, etc.) are allowed.");
            }
            if (READ_KEYWORDS.contains(token.text().toUpperCase(Locale.ROOT))) {
                hasReadClause = true;
            }
            if (token.isWord("CALL")) {
                procedureName = new StringBuilder();
            }
        }
        if (procedureName != null) {
            var rejection = checkProcedure(procedureName.toString());
            if (rejection != null) {
                return rejection;
            }
        }

        if (!hasReadClause) {
            return Classification.rejected("Query must contain MATCH or RETURN clause");
        }
        return Classification.readOnly();
    }

    /** True when the parameter appears as {@code $name} outside literals and comments. */
    public static boolean referencesParameter(String text, String parameterName) {
        try {
            return CypherTokenizer.tokenize(text).stream()
                .anyMatch(t -> t.type() == TokenType.PARAMETER && t.text().equals(parameterName));
        } catch (CypherTokenizer.TokenizationException e) {
            return false;
        }
    }

    private static Classification checkProcedure(String name) {
        var lowerCaseName = name.toLowerCase(Locale.ROOT) + ".";
        return DYNAMIC_CYPHER_PROCEDURE_PREFIXES.stream().anyMatch(lowerCaseName::startsWith)
            ? Classification.rejected("Query calls procedure '" + name + "', which runs Cypher given as a string")
            : null;
    }

    private static boolean isWriteKeyword(Token token) {
        return WRITE_KEYWORDS.contains(token.text().toUpperCase(Locale.ROOT));
    }

    private static boolean isQualifiedName(Token token) {
        return token.follows('.') || token.follows(':');
    }
}
