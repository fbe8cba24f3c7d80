package io.github.sparkrew.callflow.flow_extractor.parser;

import io.github.sparkrew.callflow.flow_extractor.model.ImportRef;
import io.github.sparkrew.callflow.flow_extractor.model.Invocation;
import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.utils.NameFilter;
import io.github.sparkrew.callflow.flow_extractor.utils.SourceMasker;
import io.github.sparkrew.callflow.flow_extractor.utils.SourceText;
import org.eclipse.jdt.core.compiler.CategorizedProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.code.CtConstructorCall;
import spoon.reflect.code.CtExecutableReferenceExpression;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtFieldAccess;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.code.CtTargetedExpression;
import spoon.reflect.code.CtTypeAccess;
import spoon.reflect.cu.CompilationUnit;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtAnnotationType;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtEnum;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtImport;
import spoon.reflect.declaration.CtInterface;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtPackage;
import spoon.reflect.declaration.CtRecord;
import spoon.reflect.declaration.CtType;
import spoon.reflect.declaration.CtTypeMember;
import spoon.reflect.declaration.CtTypeParameter;
import spoon.reflect.reference.CtTypeReference;
import spoon.reflect.visitor.filter.TypeFilter;
import spoon.support.compiler.VirtualFile;
import spoon.support.compiler.jdt.JDTBasedSpoonCompiler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar-based parser built on Spoon.
 * <p>
 * Each file is compiled on its own in no-classpath mode, so references to other project classes
 * stay unresolved; we only read declarations and the shape of expressions. Receivers are taken from
 * the original text at the element's position, which keeps them exactly as written. When Spoon
 * cannot build a model for a file, or the file has syntax errors that Spoon silently recovers from
 * by dropping members, that file is handed to the fallback parser.
 */
public class SpoonSourceUnitParser implements SourceUnitParser {

    private static final Logger log = LoggerFactory.getLogger(SpoonSourceUnitParser.class);
    private static final Pattern CONSTRUCTED_TYPE_PATTERN = Pattern.compile(
            "^new\\s+((?:[A-Za-z_$][\\w$]*\\s*\\.\\s*)*[A-Za-z_$][\\w$]*)");
    private static final Set<String> IMPLICIT_SUPERTYPES = Set.of(
            "java.lang.Object", "java.lang.Enum", "java.lang.Record", "java.lang.annotation.Annotation");
    private static final int COMPLIANCE_LEVEL = 17;

    private final SourceUnitParser fallback;

    public SpoonSourceUnitParser() {
        this(new RegexSourceUnitParser());
    }

    public SpoonSourceUnitParser(SourceUnitParser fallback) {
        this.fallback = fallback;
    }

    @Override
    public List<SourceUnit> parse(Path file, String text) throws SourceParseException {
        CtModel model;
        try {
            model = buildModel(file, text);
        } catch (SourceParseException e) {
            log.warn("Spoon rejected {}, falling back to the regex parser", e.getMessage());
            return fallback.parse(file, text);
        } catch (Exception e) {
            log.warn("Spoon could not build a model for {} ({}), falling back to the regex parser",
                    file, e.getMessage());
            return fallback.parse(file, text);
        }
        List<CtType<?>> types = collectTypes(model);
        if (types.isEmpty()) {
            throw new SourceParseException(file, "no class, interface, enum or record declaration found");
        }
        SourceText source = new SourceText(text);
        String masked = SourceMasker.mask(text);
        String packageName = packageOf(model);
        List<ImportRef> imports = collectImports(types.get(0), text);
        List<SourceUnit> units = new ArrayList<>();
        for (CtType<?> type : types) {
            units.add(toUnit(file, type, packageName, imports, source, masked));
        }
        log.debug("Parsed {} with Spoon: {} types", file, units.size());
        return units;
    }

    /**
     * Builds the Spoon model of one file.
     *
     * @throws SourceParseException if the compiler reported a syntax error. Unresolved references
     *                              are expected without a classpath and do not count.
     */
    CtModel buildModel(Path file, String text) throws SourceParseException {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : "Unknown.java";
        Launcher launcher = new Launcher();
        launcher.addInputResource(new VirtualFile(text, fileName));
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setCommentEnabled(false);
        launcher.getEnvironment().setComplianceLevel(COMPLIANCE_LEVEL);
        launcher.getEnvironment().disableConsistencyChecks();
        CtModel model = launcher.buildModel();
        if (launcher.getModelBuilder() instanceof JDTBasedSpoonCompiler compiler) {
            Optional<CategorizedProblem> syntaxError = firstSyntaxError(compiler.getProblems());
            if (syntaxError.isPresent()) {
                throw new SourceParseException(file, "syntax error at line "
                        + syntaxError.get().getSourceLineNumber() + ": " + syntaxError.get().getMessage());
            }
        }
        return model;
    }

    private static Optional<CategorizedProblem> firstSyntaxError(List<CategorizedProblem> problems) {
        return problems.stream()
                .filter(problem -> problem.isError() && problem.getCategoryID() == CategorizedProblem.CAT_SYNTAX)
                .findFirst();
    }

    /**
     * All named types of the model (top-level, nested and local) with a source position,
     * in source order.
     */
    private static List<CtType<?>> collectTypes(CtModel model) {
        List<CtType<?>> types = new ArrayList<>();
        Set<CtType<?>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CtType<?> topLevel : model.getAllTypes()) {
            for (CtType<?> type : topLevel.getElements(new TypeFilter<>(CtType.class))) {
                if (seen.add(type) && !(type instanceof CtTypeParameter) && !type.isAnonymous()
                        && !simpleNameOf(type).isEmpty() && type.getPosition().isValidPosition()) {
                    types.add(type);
                }
            }
        }
        types.sort(Comparator.comparingInt(t -> t.getPosition().getSourceStart()));
        return types;
    }

    // Local classes get a numeric prefix in Spoon ("1Local")
    private static String simpleNameOf(CtType<?> type) {
        return type.getSimpleName().replaceFirst("^\\d+", "");
    }

    private static String packageOf(CtModel model) {
        for (CtType<?> type : model.getAllTypes()) {
            CtPackage ctPackage = type.getPackage();
            if (ctPackage != null && !ctPackage.isUnnamedPackage()) {
                return ctPackage.getQualifiedName();
            }
        }
        return "";
    }

    private static List<ImportRef> collectImports(CtType<?> type, String text) {
        CompilationUnit compilationUnit = type.getPosition().getCompilationUnit();
        if (compilationUnit == null) {
            return List.of();
        }
        List<CtImport> ctImports = new ArrayList<>(compilationUnit.getImports());
        ctImports.sort(Comparator.comparingInt(SpoonSourceUnitParser::offsetOf));
        List<ImportRef> imports = new ArrayList<>();
        for (CtImport ctImport : ctImports) {
            Optional<ImportRef> ref = SyntaxSupport.parseImport(slice(ctImport, text));
            if (ref.isEmpty()) {
                ref = SyntaxSupport.parseImport(ctImport.toString());
            }
            if (ref.isPresent()) {
                imports.add(ref.get());
            } else {
                log.debug("Skipping import Spoon could not render: {}", ctImport);
            }
        }
        return imports;
    }

    private static SourceUnit toUnit(Path file, CtType<?> type, String packageName, List<ImportRef> imports,
                                     SourceText source, String masked) {
        String name = simpleNameOf(type);
        SourcePosition position = type.getPosition();
        int start = skipLeadingComments(source.text(), position.getSourceStart());
        int startLine = source.lineOf(start);
        int endLine = source.lineOf(position.getSourceEnd());
        int bodyOpen = findTypeBodyOpen(masked, start, name);
        String header = bodyOpen < 0 ? source.line(startLine) : source.slice(startLine, source.lineOf(bodyOpen));

        List<SourceMethod> methods = new ArrayList<>();
        for (CtTypeMember member : type.getTypeMembers()) {
            if (!(member instanceof CtMethod<?> || member instanceof CtConstructor<?>) || member.isImplicit()) {
                continue;
            }
            CtExecutable<?> executable = (CtExecutable<?>) member;
            if (executable.getBody() == null || !member.getPosition().isValidPosition()) {
                continue;
            }
            String methodName = member instanceof CtConstructor<?> ? name : member.getSimpleName();
            methods.add(toMethod(name, methodName, executable, source, masked));
        }
        methods.sort(Comparator.comparingInt(SourceMethod::startLine));

        return new SourceUnit(
                name,
                packageName,
                file,
                kindOf(type),
                startLine,
                endLine,
                header,
                source.slice(startLine, endLine),
                imports,
                supertypesOf(type),
                methods
        );
    }

    private static SourceMethod toMethod(String owner, String methodName, CtExecutable<?> executable,
                                         SourceText source, String masked) {
        SourcePosition position = executable.getPosition();
        int start = skipLeadingComments(source.text(), position.getSourceStart());
        int startLine = source.lineOf(start);
        int endLine = source.lineOf(position.getSourceEnd());
        return new SourceMethod(
                owner,
                methodName,
                findParameters(masked, source.text(), start, methodName),
                startLine,
                endLine,
                source.slice(startLine, endLine),
                collectInvocations(executable.getBody(), source, start)
        );
    }

    /**
     * Invocations of a body ordered by the position of the whole expression.
     */
    private static List<Invocation> collectInvocations(CtElement body, SourceText source, int fallbackOffset) {
        String text = source.text();
        List<Located> found = new ArrayList<>();
        for (CtInvocation<?> invocation : body.getElements(new TypeFilter<>(CtInvocation.class))) {
            if (invocation.getExecutable() == null) {
                continue;
            }
            String name = invocation.getExecutable().getSimpleName();
            // this(...) and super(...) constructor calls
            if ("<init>".equals(name)) {
                continue;
            }
            found.add(locate(invocation, Invocation.Kind.METHOD_CALL, receiverOf(invocation.getTarget(), text),
                    name, source, fallbackOffset));
        }
        for (CtConstructorCall<?> call : body.getElements(new TypeFilter<>(CtConstructorCall.class))) {
            found.add(locate(call, Invocation.Kind.CONSTRUCTOR_CALL, constructedTypeOf(call, text), "new",
                    source, fallbackOffset));
        }
        for (CtFieldAccess<?> access : body.getElements(new TypeFilter<>(CtFieldAccess.class))) {
            CtExpression<?> target = access.getTarget();
            if (target == null || target.isImplicit() || access.getVariable() == null) {
                continue;
            }
            found.add(locate(access, Invocation.Kind.TYPE_REFERENCE, receiverOf(target, text),
                    access.getVariable().getSimpleName(), source, fallbackOffset));
        }
        for (CtExecutableReferenceExpression<?, ?> reference
                : body.getElements(new TypeFilter<>(CtExecutableReferenceExpression.class))) {
            String name = reference.getExecutable() == null ? "" : reference.getExecutable().getSimpleName();
            found.add(locate(reference, Invocation.Kind.METHOD_REFERENCE, receiverOf(reference.getTarget(), text),
                    "<init>".equals(name) ? "new" : name, source, fallbackOffset));
        }
        // Qualified names Spoon could not split into a field access, e.g. an unresolved "Color.RED"
        for (CtTypeAccess<?> access : body.getElements(new TypeFilter<>(CtTypeAccess.class))) {
            if (access.isImplicit() || isTargetOfParent(access)) {
                continue;
            }
            String written = NameFilter.filterName(slice(access, text));
            int lastDot = written.lastIndexOf('.');
            if (lastDot > 0 && NameFilter.isDottedName(written)) {
                found.add(locate(access, Invocation.Kind.TYPE_REFERENCE, written.substring(0, lastDot),
                        written.substring(lastDot + 1), source, fallbackOffset));
            }
        }
        found.sort(Comparator.comparingInt(Located::offset));
        return found.stream().map(Located::invocation).toList();
    }

    private static Located locate(CtElement element, Invocation.Kind kind, String receiver, String name,
                                  SourceText source, int fallbackOffset) {
        int offset = element.getPosition().isValidPosition() ? element.getPosition().getSourceStart() : fallbackOffset;
        return new Located(offset, new Invocation(kind, receiver, name, source.lineOf(offset)));
    }

    private static boolean isTargetOfParent(CtTypeAccess<?> access) {
        return access.isParentInitialized()
                && access.getParent() instanceof CtTargetedExpression<?, ?> parent
                && parent.getTarget() == access;
    }

    /**
     * The receiver exactly as written, "" for an implicit one and
     * {@link Invocation#EXPRESSION_RECEIVER} for anything that is not a dotted name.
     */
    private static String receiverOf(CtExpression<?> target, String text) {
        if (target == null || target.isImplicit()) {
            return "";
        }
        String written = slice(target, text);
        if (written != null) {
            String name = NameFilter.filterName(written);
            return NameFilter.isDottedName(name) ? name : Invocation.EXPRESSION_RECEIVER;
        }
        if (target instanceof CtTypeAccess<?> typeAccess && typeAccess.getAccessedType() != null) {
            return typeAccess.getAccessedType().getSimpleName();
        }
        return Invocation.EXPRESSION_RECEIVER;
    }

    private static String constructedTypeOf(CtConstructorCall<?> call, String text) {
        String written = slice(call, text);
        if (written != null) {
            Matcher m = CONSTRUCTED_TYPE_PATTERN.matcher(written);
            if (m.find()) {
                return NameFilter.filterName(m.group(1));
            }
        }
        // Qualified instance creation such as outer.new Inner()
        return call.getType() == null ? Invocation.EXPRESSION_RECEIVER : call.getType().getSimpleName();
    }

    private static List<String> supertypesOf(CtType<?> type) {
        List<CtTypeReference<?>> references = new ArrayList<>();
        if (type.getSuperclass() != null) {
            references.add(type.getSuperclass());
        }
        references.addAll(type.getSuperInterfaces());
        return references.stream()
                .filter(r -> !r.isImplicit() && !IMPLICIT_SUPERTYPES.contains(r.getQualifiedName()))
                .sorted(Comparator.comparingInt(SpoonSourceUnitParser::offsetOf))
                .map(CtTypeReference::getSimpleName)
                .toList();
    }

    private static String kindOf(CtType<?> type) {
        if (type instanceof CtAnnotationType<?>) {
            return "annotation";
        }
        if (type instanceof CtRecord) {
            return "record";
        }
        if (type instanceof CtEnum<?>) {
            return "enum";
        }
        if (type instanceof CtInterface<?>) {
            return "interface";
        }
        return "class";
    }

    private static int offsetOf(CtElement element) {
        SourcePosition position = element.getPosition();
        return position.isValidPosition() ? position.getSourceStart() : Integer.MAX_VALUE;
    }

    private static String slice(CtElement element, String text) {
        SourcePosition position = element.getPosition();
        if (position == null || !position.isValidPosition()) {
            return null;
        }
        int start = position.getSourceStart();
        int end = position.getSourceEnd() + 1;
        if (start < 0 || end > text.length() || start >= end) {
            return null;
        }
        return text.substring(start, end);
    }

    /**
     * Declaration positions may start at a leading Javadoc or comment; the declaration itself starts
     * after it.
     */
    private static int skipLeadingComments(String text, int offset) {
        int i = offset;
        while (true) {
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (text.startsWith("/*", i)) {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    return offset;
                }
                i = end + 2;
            } else if (text.startsWith("//", i)) {
                int end = text.indexOf('\n', i);
                if (end < 0) {
                    return offset;
                }
                i = end + 1;
            } else {
                return i;
            }
        }
    }

    private static int findTypeBodyOpen(String masked, int from, String name) {
        Pattern header = Pattern.compile(
                "(?<![\\w$.@])(?:@\\s*interface|class|interface|enum|record)\\s+" + Pattern.quote(name) + "(?![\\w$])");
        Matcher m = header.matcher(masked);
        return m.find(from) ? SyntaxSupport.findBodyStart(masked, m.end()) : -1;
    }

    private static String findParameters(String masked, String text, int from, String name) {
        Matcher m = Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "\\s*\\(").matcher(masked);
        if (!m.find(from)) {
            return "";
        }
        int open = m.end() - 1;
        int close = SyntaxSupport.findMatching(masked, open, '(', ')');
        return close < 0 ? "" : SyntaxSupport.normalizeWhitespace(text.substring(open + 1, close));
    }

    private record Located(int offset, Invocation invocation) {
    }
}
