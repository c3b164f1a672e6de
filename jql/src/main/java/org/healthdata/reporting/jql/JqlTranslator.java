package org.healthdata.reporting.jql;

import java.util.List;

import org.healthdata.reporting.jql.ir.CompiledQuery;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The translation path: parse, compile, resolve indexes and build the sort clause in one call.
 */
@Slf4j
@Getter
public class JqlTranslator {
    private final JqlParser parser;
    private final QueryCompiler compiler;
    private final IndexResolver indexResolver;
    private final JqlValidator validator;

    public JqlTranslator(JqlParser parser, QueryCompiler compiler, IndexResolver indexResolver) {
        this.parser = parser;
        this.compiler = compiler;
        this.indexResolver = indexResolver;
        this.validator = new JqlValidator(parser, indexResolver);
    }

    public JqlTranslator(IndexResolver indexResolver) {
        this(new JqlParser(), new QueryCompiler(), indexResolver);
    }

    /**
     * @throws JqlTranslationException when {@code jql} is null or translation fails unexpectedly
     */
    public CompiledQuery translate(String jql, List<String> allowed) {
        if (jql == null) {
            throw new JqlTranslationException("query text is missing");
        }
        try {
            ParsedQuery parsed = parser.parse(jql);
            ObjectNode document = compiler.compile(parsed);
            List<String> indexes = indexResolver.resolve(parsed.projects(), allowed);
            ArrayNode sort = compiler.compileSort(parsed).orElse(null);
            log.debug("Translated JQL to {} over indexes {}", document, indexes);
            return new CompiledQuery(document, indexes, sort, parsed.limit());
        } catch (RuntimeException e) {
            log.error("Failed to convert JQL to a search query", e);
            throw new JqlTranslationException(e.getMessage(), e);
        }
    }

    public ValidationResult validate(String jql, List<String> allowed) {
        return validator.validate(jql, allowed);
    }
}
