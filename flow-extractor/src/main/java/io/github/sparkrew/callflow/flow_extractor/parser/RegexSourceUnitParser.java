package io.github.sparkrew.callflow.flow_extractor.parser;

import io.github.sparkrew.callflow.flow_extractor.model.ImportRef;
import io.github.sparkrew.callflow.flow_extractor.model.Invocation;
import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.utils.NameFilter;
import io.github.sparkrew.callflow.flow_extractor.utils.SourceMasker;
import io.github.sparkrew.callflow.flow_extractor.utils.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic parser that works on the raw text only.
 * <p>
 * Comments and literals are masked first, so braces and keywords inside them never count. Type
 * declarations and method headers are found with patterns; their extent is the matching closing
 * brace. A method belongs to a type when its name sits directly in the type body (brace depth one
 * below the type's opening brace). Pathological formatting can still fool it, e.g. a return type
 * on its own line is left out of the method's range.
 */
public class RegexSourceUnitParser implements SourceUnitParser {

    private static final Logger log = LoggerFactory.getLogger(RegexSourceUnitParser.class);

    private static final Pattern PACKAGE_PATTERN = Pattern.compile(
            "^\\s*package\\s+([\\w$]+(?:\\s*\\.\\s*[\\w$]+)*)\\s*;", Pattern.MULTILINE);
    private static final Pattern IMPORT_LINE_PATTERN = Pattern.compile(
            "^\\s*import\\s+[^;]+;", Pattern.MULTILINE);
    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "(?<![\\w$.@])(@\\s*interface|class|interface|enum|record)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern MEMBER_NAME_PATTERN = Pattern.compile(
            "(?<![\\w$])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern THROWS_AND_BODY_PATTERN = Pattern.compile(
            "\\s*(?:throws\\s+[\\w$.,\\s<>]+?)?\\s*\\{");
    private static final Pattern SUPERCLASS_PATTERN = Pattern.compile(
            "\\bextends\\s+(.+?)(?=\\bimplements\\b|\\bpermits\\b|$)", Pattern.DOTALL);
    private static final Pattern INTERFACES_PATTERN = Pattern.compile(
            "\\bimplements\\s+(.+?)(?=\\bpermits\\b|$)", Pattern.DOTALL);

    private static final Pattern CONSTRUCTOR_CALL_PATTERN = Pattern.compile(
            "(?<![\\w$.])new\\s+((?:[A-Za-z_$][\\w$]*\\s*\\.\\s*)*[A-Za-z_$][\\w$]*)\\s*(?:<[^;{}()]*?>)?\\s*\\(");
    private static final Pattern CALL_PATTERN = Pattern.compile(
            "(?<![\\w$])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern METHOD_REFERENCE_PATTERN = Pattern.compile(
            "(?<![\\w$.])((?:[A-Za-z_$][\\w$]*\\s*\\.\\s*)*[A-Za-z_$][\\w$]*)\\s*::\\s*([A-Za-z_$][\\w$]*)");
    private static final Pattern TYPE_REFERENCE_PATTERN = Pattern.compile(
            "(?<![\\w$.])((?:[A-Za-z_$][\\w$]*\\s*\\.\\s*)+)([A-Za-z_$][\\w$]*)(?![\\w$])(?!\\s*[.(])(?!\\s*::)");

    // Words that may precede "name(" without it being a method declaration
    private static final Set<String> NON_DECLARATION_PREFIXES = Set.of(
            "new", "return", "throw", "else", "case", "record", "class", "interface", "enum",
            "extends", "implements", "instanceof", "yield", "assert", "permits"
    );

    @Override
    public List<SourceUnit> parse(Path file, String text) throws SourceParseException {
        String masked = SourceMasker.mask(text);
        SourceText source = new SourceText(text);
        SourceText maskedSource = new SourceText(masked);
        int[] depths = SyntaxSupport.braceDepths(masked);
        String packageName = findPackage(masked);
        List<ImportRef> imports = findImports(masked);

        List<SourceUnit> units = new ArrayList<>();
        Matcher m = TYPE_PATTERN.matcher(masked);
        while (m.find()) {
            String kind = kindOf(m.group(1));
            String name = m.group(2);
            if ("record".equals(kind) && !isRecordHeader(masked, m.end())) {
                continue;
            }
            int open = SyntaxSupport.findBodyStart(masked, m.end());
            if (open < 0) {
                continue;
            }
            int close = SyntaxSupport.findMatching(masked, open, '{', '}');
            if (close < 0) {
                log.debug("Body of {} in {} is never closed, extending it to the end of the file", name, file);
                close = masked.length() - 1;
            }
            int startLine = extendOverAnnotations(maskedSource, source.lineOf(m.start()));
            int endLine = source.lineOf(close);
            List<SourceMethod> methods = findMethods(masked, source, maskedSource, depths, name, open, close);
            units.add(new SourceUnit(
                    name,
                    packageName,
                    file,
                    kind,
                    startLine,
                    endLine,
                    source.slice(startLine, source.lineOf(open)),
                    source.slice(startLine, endLine),
                    imports,
                    parseSupertypes(masked.substring(m.end(), open)),
                    methods
            ));
        }
        if (units.isEmpty()) {
            throw new SourceParseException(file, "no class, interface, enum or record declaration found");
        }
        log.debug("Parsed {} with the regex parser: {} types", file, units.size());
        return units;
    }

    private static String findPackage(String masked) {
        Matcher m = PACKAGE_PATTERN.matcher(masked);
        return m.find() ? m.group(1).replaceAll("\\s+", "") : "";
    }

    private static List<ImportRef> findImports(String masked) {
        List<ImportRef> imports = new ArrayList<>();
        Matcher m = IMPORT_LINE_PATTERN.matcher(masked);
        while (m.find()) {
            SyntaxSupport.parseImport(m.group()).ifPresent(imports::add);
        }
        return imports;
    }

    private static String kindOf(String keyword) {
        String normalized = keyword.replaceAll("\\s+", "");
        return "@interface".equals(normalized) ? "annotation" : normalized;
    }

    // "record" is a contextual keyword: only a header "record Name(" or "record Name<T>(" declares one
    private static boolean isRecordHeader(String masked, int afterName) {
        int i = afterName;
        while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
            i++;
        }
        if (i < masked.length() && masked.charAt(i) == '<') {
            int close = SyntaxSupport.findMatching(masked, i, '<', '>');
            if (close < 0) {
                return false;
            }
            i = close + 1;
            while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
                i++;
            }
        }
        return i < masked.length() && masked.charAt(i) == '(';
    }

    /**
     * Annotation lines directly above a declaration belong to it.
     */
    private static int extendOverAnnotations(SourceText maskedSource, int line) {
        int start = line;
        while (start > 1) {
            String previous = maskedSource.line(start - 1).trim();
            if (previous.startsWith("@") && !previous.replaceAll("\\s+", "").startsWith("@interface")) {
                start--;
            } else {
                break;
            }
        }
        return start;
    }

    private static List<String> parseSupertypes(String header) {
        // Drop record components and type parameters, they can contain "extends" too
        String cleaned = header.replaceAll("\\([^)]*\\)", " ");
        String trimmed = cleaned.trim();
        if (trimmed.startsWith("<")) {
            int close = SyntaxSupport.findMatching(trimmed, 0, '<', '>');
            trimmed = close < 0 ? "" : trimmed.substring(close + 1);
        }
        List<String> supertypes = new ArrayList<>();
        Matcher superclass = SUPERCLASS_PATTERN.matcher(trimmed);
        if (superclass.find()) {
            addTypeNames(superclass.group(1), supertypes);
        }
        Matcher interfaces = INTERFACES_PATTERN.matcher(trimmed);
        if (interfaces.find()) {
            addTypeNames(interfaces.group(1), supertypes);
        }
        return supertypes;
    }

    private static void addTypeNames(String list, List<String> target) {
        for (String part : SyntaxSupport.splitTopLevel(list)) {
            String name = NameFilter.filterName(part);
            if (NameFilter.isDottedName(name)) {
                target.add(NameFilter.simpleName(name));
            }
        }
    }

    private static List<SourceMethod> findMethods(String masked, SourceText source, SourceText maskedSource,
                                                  int[] depths, String owner, int open, int close) {
        List<SourceMethod> methods = new ArrayList<>();
        int bodyDepth = depths[open] + 1;
        Matcher m = MEMBER_NAME_PATTERN.matcher(masked);
        m.useTransparentBounds(true);
        m.region(open + 1, close);
        while (m.find()) {
            int nameStart = m.start(1);
            String name = m.group(1);
            if (depths[nameStart] != bodyDepth || NameFilter.isKeyword(name)
                    || !looksLikeDeclaration(masked, nameStart, name, owner, open)) {
                continue;
            }
            int openParen = m.end() - 1;
            int closeParen = SyntaxSupport.findMatching(masked, openParen, '(', ')');
            if (closeParen < 0) {
                continue;
            }
            Matcher body = THROWS_AND_BODY_PATTERN.matcher(masked);
            body.region(closeParen + 1, masked.length());
            if (!body.lookingAt()) {
                // Abstract, interface or annotation member without a body
                continue;
            }
            int bodyOpen = body.end() - 1;
            int bodyClose = SyntaxSupport.findMatching(masked, bodyOpen, '{', '}');
            if (bodyClose < 0) {
                bodyClose = masked.length() - 1;
            }
            int startLine = extendOverAnnotations(maskedSource, source.lineOf(nameStart));
            int endLine = source.lineOf(bodyClose);
            methods.add(new SourceMethod(
                    owner,
                    name,
                    SyntaxSupport.normalizeWhitespace(source.text().substring(openParen + 1, closeParen)),
                    startLine,
                    endLine,
                    source.slice(startLine, endLine),
                    findInvocations(masked, source, bodyOpen, bodyClose)
            ));
        }
        return methods;
    }

    private static boolean looksLikeDeclaration(String masked, int nameStart, String name, String owner,
                                                int lowerBound) {
        int i = SyntaxSupport.skipWhitespaceBackward(masked, nameStart - 1, lowerBound);
        if (i < lowerBound) {
            return false;
        }
        char c = masked.charAt(i);
        if (c == ']') {
            return true;
        }
        if (c == '>') {
            // generic return type, but not a lambda arrow
            return i == 0 || masked.charAt(i - 1) != '-';
        }
        if (Character.isJavaIdentifierPart(c)) {
            int wordEnd = i + 1;
            while (i >= lowerBound && Character.isJavaIdentifierPart(masked.charAt(i))) {
                i--;
            }
            String word = masked.substring(i + 1, wordEnd);
            return !NON_DECLARATION_PREFIXES.contains(word);
        }
        // A constructor without modifiers follows the previous member directly
        return name.equals(owner) && (c == '{' || c == '}' || c == ';' || c == ')');
    }

    /**
     * Collects the call-like expressions between the braces of a method body, ordered by position.
     */
    static List<Invocation> findInvocations(String masked, SourceText source, int from, int to) {
        List<Located> found = new ArrayList<>();
        List<int[]> constructorSpans = new ArrayList<>();

        Matcher constructors = CONSTRUCTOR_CALL_PATTERN.matcher(masked);
        constructors.useTransparentBounds(true);
        constructors.region(from, to);
        while (constructors.find()) {
            constructorSpans.add(new int[]{constructors.start(), constructors.end()});
            found.add(new Located(constructors.start(), new Invocation(Invocation.Kind.CONSTRUCTOR_CALL,
                    NameFilter.filterName(constructors.group(1)), "new", source.lineOf(constructors.start()))));
        }

        Matcher calls = CALL_PATTERN.matcher(masked);
        calls.useTransparentBounds(true);
        calls.region(from, to);
        while (calls.find()) {
            int nameStart = calls.start(1);
            String name = calls.group(1);
            if (NameFilter.isKeyword(name) || insideAny(constructorSpans, nameStart)) {
                continue;
            }
            String receiver = receiverBefore(masked, nameStart, from);
            found.add(new Located(nameStart, new Invocation(Invocation.Kind.METHOD_CALL, receiver, name,
                    source.lineOf(nameStart))));
        }

        Matcher references = METHOD_REFERENCE_PATTERN.matcher(masked);
        references.useTransparentBounds(true);
        references.region(from, to);
        while (references.find()) {
            found.add(new Located(references.start(), new Invocation(Invocation.Kind.METHOD_REFERENCE,
                    NameFilter.filterName(references.group(1)), references.group(2),
                    source.lineOf(references.start()))));
        }

        Matcher types = TYPE_REFERENCE_PATTERN.matcher(masked);
        types.useTransparentBounds(true);
        types.region(from, to);
        while (types.find()) {
            if (insideAny(constructorSpans, types.start())) {
                continue;
            }
            String chain = NameFilter.filterName(types.group(1));
            String receiver = chain.endsWith(".") ? chain.substring(0, chain.length() - 1) : chain;
            found.add(new Located(types.start(), new Invocation(Invocation.Kind.TYPE_REFERENCE, receiver,
                    types.group(2), source.lineOf(types.start()))));
        }

        found.sort(Comparator.comparingInt(Located::offset));
        return found.stream().map(Located::invocation).toList();
    }

    /**
     * The dotted chain written before a member name, "" without receiver and
     * {@link Invocation#EXPRESSION_RECEIVER} when the receiver is not a plain name.
     */
    private static String receiverBefore(String masked, int nameStart, int lowerBound) {
        int i = SyntaxSupport.skipWhitespaceBackward(masked, nameStart - 1, lowerBound);
        if (i >= lowerBound && masked.charAt(i) == '>') {
            // Explicit type arguments: Helper.<String>log(...)
            i = SyntaxSupport.skipWhitespaceBackward(masked, typeArgumentsStart(masked, i, lowerBound) - 1,
                    lowerBound);
        }
        if (i < lowerBound || masked.charAt(i) != '.') {
            return "";
        }
        List<String> segments = new ArrayList<>();
        while (true) {
            int j = SyntaxSupport.skipWhitespaceBackward(masked, i - 1, lowerBound);
            if (j < lowerBound || !Character.isJavaIdentifierPart(masked.charAt(j))) {
                return Invocation.EXPRESSION_RECEIVER;
            }
            int end = j + 1;
            while (j >= lowerBound && Character.isJavaIdentifierPart(masked.charAt(j))) {
                j--;
            }
            String segment = masked.substring(j + 1, end);
            if (!Character.isJavaIdentifierStart(segment.charAt(0))) {
                return Invocation.EXPRESSION_RECEIVER;
            }
            segments.add(0, segment);
            int k = SyntaxSupport.skipWhitespaceBackward(masked, j, lowerBound);
            if (k >= lowerBound && masked.charAt(k) == '.') {
                i = k;
            } else {
                return String.join(".", segments);
            }
        }
    }

    /**
     * Offset of the '<' matching the '>' at {@code close}, or {@code lowerBound - 1} when the '>' does
     * not close type arguments (a comparison or a lambda arrow).
     */
    private static int typeArgumentsStart(String masked, int close, int lowerBound) {
        int depth = 0;
        for (int i = close; i >= lowerBound; i--) {
            char c = masked.charAt(i);
            if (c == '>') {
                depth++;
            } else if (c == '<' && --depth == 0) {
                return i;
            } else if ("(){};=".indexOf(c) >= 0) {
                break;
            }
        }
        return lowerBound - 1;
    }

    private static boolean insideAny(List<int[]> spans, int offset) {
        for (int[] span : spans) {
            if (offset >= span[0] && offset < span[1]) {
                return true;
            }
        }
        return false;
    }

    private record Located(int offset, Invocation invocation) {
    }
}
