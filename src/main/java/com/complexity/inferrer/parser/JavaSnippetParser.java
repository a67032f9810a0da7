package com.complexity.inferrer.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Java front end for the complexity engine. Parses a snippet with JavaParser
 * and lowers it to the engine's syntax tree.
 *
 * A snippet may be a whole compilation unit, bare class members (methods and
 * fields) or bare statements; the forms are tried in that order. When none
 * parses, the problems of the compilation-unit attempt are reported.
 *
 * Not thread-safe: the underlying {@link JavaParser} keeps per-parse state.
 */
public class JavaSnippetParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSnippetParser.class);

    static final String WRAPPER_CLASS = "__Snippet__";

    private final JavaParser javaParser;
    private final JavaSyntaxLowering lowering;

    public JavaSnippetParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public JavaSnippetParser(ParserConfiguration.LanguageLevel languageLevel) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(languageLevel);
        this.javaParser = new JavaParser(parserConfig);
        this.lowering = new JavaSyntaxLowering();
    }

    /**
     * Parses and lowers the snippet.
     */
    public ParseOutcome parse(String source) {
        JavaSnippet snippet = parseJava(source);
        if (!snippet.isParsed()) {
            return ParseOutcome.failure(snippet.getDiagnostic());
        }
        return ParseOutcome.success(lowering.lower(snippet.getRoot().get()));
    }

    /**
     * Parses the snippet into a JavaParser tree without lowering it.
     */
    public JavaSnippet parseJava(String source) {
        ParseResult<CompilationUnit> unit = javaParser.parse(source);
        if (unit.isSuccessful() && unit.getResult().isPresent()) {
            return JavaSnippet.parsed(unit.getResult().get(), JavaSnippet.Form.COMPILATION_UNIT);
        }

        ParseResult<CompilationUnit> members = javaParser.parse("class " + WRAPPER_CLASS + " {\n" + source + "\n}");
        if (members.isSuccessful() && members.getResult().isPresent()) {
            logger.debug("Parsed snippet as class members");
            return JavaSnippet.parsed(members.getResult().get(), JavaSnippet.Form.CLASS_MEMBERS);
        }

        ParseResult<BlockStmt> statements = javaParser.parseBlock("{\n" + source + "\n}");
        if (statements.isSuccessful() && statements.getResult().isPresent()) {
            logger.debug("Parsed snippet as statements");
            return JavaSnippet.parsed(statements.getResult().get(), JavaSnippet.Form.STATEMENTS);
        }

        String diagnostic = describe(unit.getProblems());
        logger.debug("Snippet does not parse: {}", diagnostic);
        return JavaSnippet.failed(diagnostic);
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "Unknown parse error";
        }
        return problems.stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("\n"));
    }
}
