package org.refactor.graphdiff;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 源码解析入口。
 * <p>
 * 变更分析拿到的往往是代码片段而不是完整文件，所以依次尝试：
 * <ol>
 *     <li>完整编译单元</li>
 *     <li>包成类体：{@code class __Snippet__ { ... }}（方法、字段片段）</li>
 *     <li>包成方法体：{@code class __Snippet__ { void __snippet__() { ... } }}（语句片段）</li>
 * </ol>
 * 都失败时返回第一步的语法错误，调用方据此退化成只有一个错误节点的图，不抛异常。
 * <p>
 * 每次解析都新建 JavaParser 实例，同一个 SourceParser 可以被多个线程共用。
 */
public class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceParser.class);

    public static final String SNIPPET_CLASS = "__Snippet__";
    public static final String SNIPPET_METHOD = "__snippet__";

    private final ParserConfiguration.LanguageLevel languageLevel;

    public SourceParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public SourceParser(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    public ParsedSource parse(String code) {
        if (code == null) {
            return ParsedSource.failure("ParseError: source is null");
        }

        ParseResult<CompilationUnit> whole = newParser().parse(code);
        if (whole.isSuccessful() && whole.getResult().isPresent()) {
            return ParsedSource.success(whole.getResult().get(), ParsedSource.Wrapping.NONE);
        }

        ParseResult<CompilationUnit> asMembers = newParser().parse("class " + SNIPPET_CLASS + " {\n" + code + "\n}");
        if (asMembers.isSuccessful() && asMembers.getResult().isPresent()) {
            LOG.debug("source parsed as class body snippet");
            return ParsedSource.success(asMembers.getResult().get(), ParsedSource.Wrapping.CLASS_BODY);
        }

        ParseResult<CompilationUnit> asStatements = newParser().parse(
                "class " + SNIPPET_CLASS + " { void " + SNIPPET_METHOD + "() {\n" + code + "\n} }");
        if (asStatements.isSuccessful() && asStatements.getResult().isPresent()) {
            LOG.debug("source parsed as statement snippet");
            return ParsedSource.success(asStatements.getResult().get(), ParsedSource.Wrapping.METHOD_BODY);
        }

        String error = describe(whole.getProblems());
        LOG.debug("source could not be parsed: {}", error);
        return ParsedSource.failure(error);
    }

    private JavaParser newParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                // 注释不挂到 AST 上，节点标签里就不会混进注释
                .setAttributeComments(false);
        return new JavaParser(config);
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "ParseError: unknown parse failure";
        }
        Problem p = problems.get(0);
        int line = p.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(-1);
        String message = p.getMessage().lines().findFirst().orElse("").trim();
        return "ParseError: " + message + " (line " + line + ")";
    }
}
