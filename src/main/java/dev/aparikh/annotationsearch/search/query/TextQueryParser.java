package dev.aparikh.annotationsearch.search.query;

import dev.aparikh.annotationsearch.error.InvalidTextSearchException;
import dev.aparikh.annotationsearch.solr.SolrFields;
import dev.aparikh.annotationsearch.solr.SolrQueryUtils;
import org.apache.lucene.queryparser.flexible.core.QueryNodeParseException;
import org.apache.lucene.queryparser.flexible.core.nodes.AndQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.BooleanQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.BoostQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.FieldQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.FuzzyQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.GroupQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.ModifierQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.OrQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.QueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.QuotedFieldQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.SlopQueryNode;
import org.apache.lucene.queryparser.flexible.core.parser.EscapeQuerySyntax;
import org.apache.lucene.queryparser.flexible.standard.nodes.RegexpQueryNode;
import org.apache.lucene.queryparser.flexible.standard.nodes.TermRangeQueryNode;
import org.apache.lucene.queryparser.flexible.standard.parser.EscapeQuerySyntaxImpl;
import org.apache.lucene.queryparser.flexible.standard.parser.StandardSyntaxParser;
import org.apache.lucene.queryparser.flexible.standard.parser.TokenMgrError;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates free-text queries written in Lucene syntax and rewrites the field names they use onto
 * the Solr schema.
 *
 * <p>The query is parsed with Lucene's {@link StandardSyntaxParser}; the resulting node tree is
 * rendered back to Solr's lucene syntax with every field name mapped. Input that does not parse, or
 * that names an unknown field, is rejected here before it reaches Solr.
 *
 * <p>Field names:
 * <ul>
 *   <li>{@code text}: every input, analyzed and lower-cased; the default field
 *   <li>{@code text.exact}: every input, split on whitespace only, case-sensitive
 *   <li>{@code inputs.<name>}: one input, analyzed
 *   <li>{@code metadata.<key>}: the stringified values of a metadata key
 *   <li>the label, agent and status fields as stored
 * </ul>
 */
public final class TextQueryParser {

    private static final String DEFAULT_FIELD = "text";

    private static final Map<String, String> FIELDS = Map.ofEntries(
            Map.entry(DEFAULT_FIELD, SolrFields.TEXT),
            Map.entry("text.exact", SolrFields.TEXT_EXACT),
            Map.entry("id", SolrFields.ID),
            Map.entry("words", SolrFields.WORDS),
            Map.entry("predicted_as", SolrFields.PREDICTED_AS),
            Map.entry("annotated_as", SolrFields.ANNOTATED_AS),
            Map.entry("predicted_by", SolrFields.PREDICTED_BY),
            Map.entry("annotated_by", SolrFields.ANNOTATED_BY),
            Map.entry("status", SolrFields.STATUS),
            Map.entry("predicted", SolrFields.PREDICTED),
            Map.entry("score", SolrFields.PREDICTION_SCORE),
            Map.entry("multi_label", SolrFields.MULTI_LABEL),
            Map.entry("event_timestamp", SolrFields.EVENT_TIMESTAMP),
            Map.entry("last_updated", SolrFields.LAST_UPDATED),
            Map.entry("*", "*")
    );

    private static final EscapeQuerySyntax ESCAPER = new EscapeQuerySyntaxImpl();

    /**
     * Returns the Solr form of {@code text}, or a match-all query when it is blank.
     *
     * @throws InvalidTextSearchException if {@code text} is not a valid query
     */
    public String rewrite(String text) {
        if (text.isBlank() || SolrQueryUtils.MATCH_ALL.equals(text.strip())) {
            return SolrQueryUtils.MATCH_ALL;
        }
        try {
            QueryNode root = new StandardSyntaxParser().parse(text, DEFAULT_FIELD);
            return render(root, false);
        } catch (QueryNodeParseException | TokenMgrError | IllegalArgumentException e) {
            throw new InvalidTextSearchException(text, e);
        }
    }

    static String rewriteField(@Nullable CharSequence field) {
        String name = field == null ? DEFAULT_FIELD : field.toString();
        String mapped = FIELDS.get(name);
        if (mapped != null) {
            return mapped;
        }
        if (name.startsWith(SolrFields.INPUTS_PREFIX) && name.length() > SolrFields.INPUTS_PREFIX.length()) {
            return SolrFields.inputTextField(name.substring(SolrFields.INPUTS_PREFIX.length()));
        }
        if (name.startsWith(SolrFields.METADATA_PREFIX) && name.length() > SolrFields.METADATA_PREFIX.length()) {
            return SolrFields.metadataValuesField(name.substring(SolrFields.METADATA_PREFIX.length()));
        }
        throw new IllegalArgumentException("Unknown field " + name);
    }

    // Nested boolean nodes are parenthesized so Solr sees the same structure the parser built.
    private static String render(QueryNode node, boolean nested) {
        if (node instanceof GroupQueryNode group) {
            return "(" + render(group.getChild(), false) + ")";
        }
        if (node instanceof BooleanQueryNode bool) {
            String separator = bool instanceof AndQueryNode ? " AND " : bool instanceof OrQueryNode ? " OR " : " ";
            String joined = bool.getChildren().stream()
                    .map(child -> render(child, true))
                    .collect(Collectors.joining(separator));
            return nested ? "(" + joined + ")" : joined;
        }
        if (node instanceof ModifierQueryNode modifier) {
            String child = render(modifier.getChild(), true);
            return switch (modifier.getModifier()) {
                case MOD_REQ -> "+" + child;
                case MOD_NOT -> "-" + child;
                case MOD_NONE -> child;
            };
        }
        if (node instanceof BoostQueryNode boost) {
            return render(boost.getChild(), true) + "^" + number(boost.getValue());
        }
        if (node instanceof SlopQueryNode slop) {
            return render(slop.getChild(), true) + "~" + slop.getValue();
        }
        if (node instanceof TermRangeQueryNode range) {
            return rewriteField(range.getField()) + ":"
                    + (range.isLowerInclusive() ? "[" : "{")
                    + bound(range.getLowerBound()) + " TO " + bound(range.getUpperBound())
                    + (range.isUpperInclusive() ? "]" : "}");
        }
        if (node instanceof RegexpQueryNode regexp) {
            return rewriteField(regexp.getField()) + ":/" + regexp.getText() + "/";
        }
        if (node instanceof QuotedFieldQueryNode quoted) {
            return rewriteField(quoted.getField()) + ":\""
                    + ESCAPER.escape(quoted.getText(), Locale.ROOT, EscapeQuerySyntax.Type.STRING) + "\"";
        }
        if (node instanceof FuzzyQueryNode fuzzy) {
            return term(fuzzy) + "~" + number(fuzzy.getSimilarity());
        }
        if (node instanceof FieldQueryNode field) {
            return term(field);
        }
        throw new IllegalArgumentException("Unsupported query construct " + node.getClass().getSimpleName());
    }

    private static String term(FieldQueryNode node) {
        return rewriteField(node.getField()) + ":" + ESCAPER.escape(node.getText(), Locale.ROOT, EscapeQuerySyntax.Type.NORMAL);
    }

    private static String bound(@Nullable FieldQueryNode bound) {
        if (bound == null || bound.getText() == null || "*".contentEquals(bound.getText())) {
            return "*";
        }
        return ESCAPER.escape(bound.getText(), Locale.ROOT, EscapeQuerySyntax.Type.NORMAL).toString();
    }

    private static String number(float value) {
        return value == Math.rint(value) ? Integer.toString((int) value) : Float.toString(value);
    }
}
