package ai.phprefactor.analyzer.php;

import static ai.phprefactor.analyzer.php.PhpTreeSitterNodeTypes.*;
import static java.util.Map.entry;

import ai.phprefactor.analyzer.SourceSpan;
import ai.phprefactor.analyzer.SymbolKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Converts a TreeSitter PHP tree into {@link PhpNode}s. Conversion is driven by a table keyed on the TreeSitter node
 * type; types without an entry become {@link PhpNode.Other} with their named children converted.
 */
final class PhpTreeAdapter {
    private static final Map<String, BiFunction<PhpTreeAdapter, TSNode, PhpNode>> CONVERTERS = Map.ofEntries(
            entry(NAMESPACE_DEFINITION, PhpTreeAdapter::namespace),
            entry(CLASS_DECLARATION, (a, n) -> a.classLike(n, SymbolKind.CLASS)),
            entry(INTERFACE_DECLARATION, (a, n) -> a.classLike(n, SymbolKind.INTERFACE)),
            entry(TRAIT_DECLARATION, (a, n) -> a.classLike(n, SymbolKind.TRAIT)),
            entry(ENUM_DECLARATION, (a, n) -> a.classLike(n, SymbolKind.ENUM)),
            entry(METHOD_DECLARATION, (a, n) -> a.function(n, PhpNode.FunctionKind.METHOD)),
            entry(FUNCTION_DEFINITION, (a, n) -> a.function(n, PhpNode.FunctionKind.FUNCTION)),
            entry(ANONYMOUS_FUNCTION, (a, n) -> a.function(n, PhpNode.FunctionKind.CLOSURE)),
            entry(ANONYMOUS_FUNCTION_CREATION_EXPRESSION, (a, n) -> a.function(n, PhpNode.FunctionKind.CLOSURE)),
            entry(ARROW_FUNCTION, (a, n) -> a.function(n, PhpNode.FunctionKind.ARROW_FUNCTION)),
            entry(SIMPLE_PARAMETER, PhpTreeAdapter::parameter),
            entry(VARIADIC_PARAMETER, PhpTreeAdapter::parameter),
            entry(PROPERTY_PROMOTION_PARAMETER, PhpTreeAdapter::parameter),
            entry(PROPERTY_DECLARATION, PhpTreeAdapter::propertyDeclaration),
            entry(OBJECT_CREATION_EXPRESSION, PhpTreeAdapter::objectCreation),
            entry(MEMBER_CALL_EXPRESSION, PhpTreeAdapter::memberCall),
            entry(NULLSAFE_MEMBER_CALL_EXPRESSION, PhpTreeAdapter::memberCall),
            entry(MEMBER_ACCESS_EXPRESSION, PhpTreeAdapter::memberAccess),
            entry(NULLSAFE_MEMBER_ACCESS_EXPRESSION, PhpTreeAdapter::memberAccess),
            entry(SCOPED_CALL_EXPRESSION, PhpTreeAdapter::scopedCall),
            entry(CLASS_CONSTANT_ACCESS_EXPRESSION, PhpTreeAdapter::classConstantAccess),
            entry(SCOPED_PROPERTY_ACCESS_EXPRESSION, PhpTreeAdapter::scopedPropertyAccess),
            entry(ASSIGNMENT_EXPRESSION, PhpTreeAdapter::assignment),
            entry(VARIABLE_NAME, PhpTreeAdapter::variable),
            entry(NAMESPACE_USE_DECLARATION, PhpTreeAdapter::useDeclaration),
            entry(NAME, PhpTreeAdapter::nameReference),
            entry(QUALIFIED_NAME, PhpTreeAdapter::nameReference),
            entry(NAMESPACE_NAME, PhpTreeAdapter::nameReference),
            entry(COMPOUND_STATEMENT, (a, n) -> new PhpNode.Block(a.span(n), a.convertNamed(n))),
            entry(PARENTHESIZED_EXPRESSION, PhpTreeAdapter::unwrap));

    private static final Set<String> TYPE_CONTAINERS = Set.of(
            "named_type",
            "optional_type",
            "union_type",
            "intersection_type",
            "disjunctive_normal_form_type",
            "type_list",
            PRIMITIVE_TYPE,
            "bottom_type",
            NAME,
            QUALIFIED_NAME,
            RELATIVE_SCOPE);

    private final SourceText source;

    PhpTreeAdapter(SourceText source) {
        this.source = source;
    }

    PhpNode.Program program(TSNode root) {
        return new PhpNode.Program(span(root), convertNamed(root));
    }

    /** First ERROR node in document order, if any. */
    static Optional<TSNode> findError(TSNode root) {
        var stack = new ArrayDeque<TSNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (ERROR.equals(node.getType())) {
                return Optional.of(node);
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                var child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    stack.push(child);
                }
            }
        }
        return Optional.empty();
    }

    PhpNode convert(TSNode node) {
        var converter = CONVERTERS.get(node.getType());
        if (converter != null) {
            return converter.apply(this, node);
        }
        return other(node);
    }

    private PhpNode other(TSNode node) {
        return new PhpNode.Other(node.getType(), span(node), convertNamed(node));
    }

    // ---- declarations ----

    private PhpNode namespace(TSNode node) {
        var nameNode = field(node, "name");
        if (nameNode == null) {
            nameNode = firstChildOfType(node, NAMESPACE_NAME);
        }
        var body = field(node, "body");
        if (body == null) {
            body = firstChildOfType(node, COMPOUND_STATEMENT);
        }
        var name = nameNode == null ? "" : stripLeadingSeparator(text(nameNode));
        var nameSpan = nameNode == null ? null : span(nameNode);
        if (body != null) {
            return new PhpNode.Namespace(name, nameSpan, span(node), true, convertNamed(body));
        }
        var semicolon = firstChildOfType(node, ";");
        var end = semicolon != null ? semicolon.getEndByte() : node.getEndByte();
        return new PhpNode.Namespace(
                name, nameSpan, source.spanForBytes(node.getStartByte(), end), false, List.of());
    }

    private PhpNode classLike(TSNode node, SymbolKind kind) {
        var nameNode = field(node, "name");
        if (nameNode == null) {
            return other(node);
        }
        var extendsTypes = new ArrayList<TypeRef>();
        var implementsTypes = new ArrayList<TypeRef>();
        var base = firstChildOfType(node, BASE_CLAUSE);
        if (base != null) {
            extendsTypes.addAll(typeRefs(base));
        }
        var interfaces = firstChildOfType(node, CLASS_INTERFACE_CLAUSE);
        if (interfaces != null) {
            implementsTypes.addAll(typeRefs(interfaces));
        }
        var body = field(node, "body");
        List<PhpNode> members = body == null ? List.of() : convertNamed(body);
        return new PhpNode.ClassLike(
                kind, text(nameNode), span(nameNode), span(node), extendsTypes, implementsTypes, members);
    }

    private PhpNode function(TSNode node, PhpNode.FunctionKind kind) {
        var nameNode = field(node, "name");
        var params = new ArrayList<PhpNode.Parameter>();
        var paramsNode = field(node, "parameters");
        if (paramsNode == null) {
            paramsNode = firstChildOfType(node, FORMAL_PARAMETERS);
        }
        if (paramsNode != null) {
            for (var p : namedChildren(paramsNode)) {
                if (convert(p) instanceof PhpNode.Parameter parameter) {
                    params.add(parameter);
                }
            }
        }
        var returnTypes = typeRefs(field(node, "return_type"));
        var body = field(node, "body");
        List<PhpNode> statements;
        if (body == null) {
            statements = List.of();
        } else if (COMPOUND_STATEMENT.equals(body.getType())) {
            statements = convertNamed(body);
        } else {
            statements = List.of(convert(body));
        }
        return new PhpNode.FunctionLike(
                kind,
                nameNode == null ? null : text(nameNode),
                nameNode == null ? null : span(nameNode),
                span(node),
                params,
                returnTypes,
                statements);
    }

    private PhpNode parameter(TSNode node) {
        var nameNode = field(node, "name");
        if (nameNode == null) {
            nameNode = firstChildOfType(node, VARIABLE_NAME);
        }
        if (nameNode == null) {
            return other(node);
        }
        var defaultValue = field(node, "default_value");
        List<PhpNode> children = defaultValue == null ? List.of() : List.of(convert(defaultValue));
        return new PhpNode.Parameter(
                variableName(nameNode),
                typeRefs(typeNode(node)),
                PROPERTY_PROMOTION_PARAMETER.equals(node.getType()),
                span(node),
                children);
    }

    private PhpNode propertyDeclaration(TSNode node) {
        var names = new ArrayList<String>();
        var children = new ArrayList<PhpNode>();
        for (var element : namedChildren(node)) {
            if (!PROPERTY_ELEMENT.equals(element.getType())) {
                continue;
            }
            boolean named = false;
            for (var part : namedChildren(element)) {
                if (!named && VARIABLE_NAME.equals(part.getType())) {
                    names.add(variableName(part));
                    named = true;
                } else {
                    children.add(convert(part));
                }
            }
        }
        return new PhpNode.PropertyDeclaration(names, typeRefs(typeNode(node)), span(node), children);
    }

    private PhpNode useDeclaration(TSNode node) {
        var kind = PhpNode.UseKind.CLASS;
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if ("function".equals(child.getType())) {
                kind = PhpNode.UseKind.FUNCTION;
            } else if ("const".equals(child.getType())) {
                kind = PhpNode.UseKind.CONSTANT;
            }
        }
        var clauses = new ArrayList<UseClause>();
        var group = firstChildOfType(node, NAMESPACE_USE_GROUP);
        String groupPrefix = null;
        if (group != null) {
            var prefixNode = firstChildOfType(node, NAMESPACE_NAME);
            if (prefixNode == null) {
                prefixNode = firstChildOfType(node, QUALIFIED_NAME);
            }
            if (prefixNode == null) {
                prefixNode = firstChildOfType(node, NAME);
            }
            groupPrefix = prefixNode == null ? "" : stripLeadingSeparator(text(prefixNode));
            for (var clauseNode : namedChildren(group)) {
                var type = clauseNode.getType();
                if (NAMESPACE_USE_CLAUSE.equals(type) || NAMESPACE_USE_GROUP_CLAUSE.equals(type)) {
                    useClause(clauseNode, groupPrefix).ifPresent(clauses::add);
                }
            }
        } else {
            for (var clauseNode : namedChildren(node)) {
                if (NAMESPACE_USE_CLAUSE.equals(clauseNode.getType())) {
                    useClause(clauseNode, null).ifPresent(clauses::add);
                }
            }
        }
        return new PhpNode.UseDeclaration(kind, clauses, groupPrefix, span(node));
    }

    private Optional<UseClause> useClause(TSNode clause, @Nullable String groupPrefix) {
        TSNode nameNode = null;
        TSNode aliasNode = field(clause, "alias");
        for (var child : namedChildren(clause)) {
            var type = child.getType();
            if (NAME.equals(type) || QUALIFIED_NAME.equals(type) || NAMESPACE_NAME.equals(type)) {
                if (nameNode == null) {
                    nameNode = child;
                } else if (aliasNode == null) {
                    aliasNode = child;
                }
            } else if (NAMESPACE_ALIASING_CLAUSE.equals(type) && aliasNode == null) {
                aliasNode = firstChildOfType(child, NAME);
            }
        }
        if (nameNode == null) {
            return Optional.empty();
        }
        var written = stripLeadingSeparator(text(nameNode));
        var fullName = groupPrefix == null || groupPrefix.isEmpty() ? written : groupPrefix + "\\" + written;
        var alias = aliasNode == null || aliasNode.getStartByte() == nameNode.getStartByte() ? null : text(aliasNode);
        return Optional.of(new UseClause(fullName, alias, span(nameNode), span(clause)));
    }

    // ---- expressions ----

    private PhpNode objectCreation(TSNode node) {
        TypeRef type = null;
        var children = new ArrayList<PhpNode>();
        for (var child : namedChildren(node)) {
            var childType = child.getType();
            if (type == null
                    && children.isEmpty()
                    && (NAME.equals(childType) || QUALIFIED_NAME.equals(childType) || RELATIVE_SCOPE.equals(childType))) {
                type = new TypeRef(text(child), span(child));
            } else {
                children.add(convert(child));
            }
        }
        return new PhpNode.NewExpression(type, span(node), children);
    }

    private PhpNode memberCall(TSNode node) {
        var object = field(node, "object");
        var name = field(node, "name");
        if (object == null || name == null) {
            var operands = operandsAround(node, "->", "?->");
            object = operands[0];
            name = operands[1];
        }
        if (object == null || name == null || !NAME.equals(name.getType())) {
            return other(node);
        }
        var arguments = field(node, "arguments");
        List<PhpNode> args = arguments == null ? List.of() : convertNamed(arguments);
        return new PhpNode.MethodCall(convert(object), text(name), span(name), span(node), args);
    }

    private PhpNode memberAccess(TSNode node) {
        var object = field(node, "object");
        var name = field(node, "name");
        if (object == null || name == null) {
            var operands = operandsAround(node, "->", "?->");
            object = operands[0];
            name = operands[1];
        }
        if (object == null || name == null || !NAME.equals(name.getType())) {
            return other(node);
        }
        return new PhpNode.PropertyLookup(convert(object), text(name), span(name), span(node));
    }

    private PhpNode scopedCall(TSNode node) {
        var scope = field(node, "scope");
        var name = field(node, "name");
        if (scope == null || name == null) {
            var operands = operandsAround(node, "::");
            scope = operands[0];
            name = operands[1];
        }
        if (scope == null || name == null || !NAME.equals(name.getType())) {
            return other(node);
        }
        var children = new ArrayList<PhpNode>();
        var scopeRef = scopeRef(scope);
        if (scopeRef == null) {
            children.add(convert(scope));
        }
        var arguments = field(node, "arguments");
        if (arguments != null) {
            children.addAll(convertNamed(arguments));
        }
        return new PhpNode.StaticCall(scopeRef, text(name), span(name), span(node), children);
    }

    private PhpNode classConstantAccess(TSNode node) {
        var named = namedChildren(node);
        if (named.size() < 2) {
            return other(node);
        }
        var scope = named.get(0);
        var member = named.get(named.size() - 1);
        var scopeRef = scopeRef(scope);
        List<PhpNode> children = scopeRef == null ? List.of(convert(scope)) : List.of();
        return new PhpNode.StaticLookup(scopeRef, text(member), span(node), children);
    }

    private PhpNode scopedPropertyAccess(TSNode node) {
        var scope = field(node, "scope");
        var name = field(node, "name");
        if (scope == null || name == null) {
            var operands = operandsAround(node, "::");
            scope = operands[0];
            name = operands[1];
        }
        if (scope == null || name == null) {
            return other(node);
        }
        var scopeRef = scopeRef(scope);
        List<PhpNode> children = scopeRef == null ? List.of(convert(scope)) : List.of();
        return new PhpNode.StaticLookup(scopeRef, text(name), span(node), children);
    }

    private PhpNode assignment(TSNode node) {
        var left = field(node, "left");
        var right = field(node, "right");
        var named = namedChildren(node);
        if (left == null && !named.isEmpty()) {
            left = named.get(0);
        }
        if (right == null && named.size() > 1) {
            right = named.get(named.size() - 1);
        }
        if (left == null || right == null) {
            return other(node);
        }
        return new PhpNode.Assignment(convert(left), convert(right), span(node));
    }

    private PhpNode variable(TSNode node) {
        return new PhpNode.Variable(variableName(node), span(node));
    }

    private PhpNode nameReference(TSNode node) {
        return new PhpNode.NameReference(new TypeRef(text(node), span(node)));
    }

    private PhpNode unwrap(TSNode node) {
        var named = namedChildren(node);
        return named.size() == 1 ? convert(named.get(0)) : other(node);
    }

    // ---- helpers ----

    private @Nullable TypeRef scopeRef(TSNode scope) {
        var type = scope.getType();
        if (NAME.equals(type) || QUALIFIED_NAME.equals(type) || RELATIVE_SCOPE.equals(type)) {
            return new TypeRef(text(scope), span(scope));
        }
        return null;
    }

    private @Nullable TSNode typeNode(TSNode declaration) {
        var typeNode = field(declaration, "type");
        if (typeNode != null) {
            return typeNode;
        }
        for (var child : namedChildren(declaration)) {
            if (TYPE_CONTAINERS.contains(child.getType()) && !NAME.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Names inside a type expression or heritage clause, each qualified name kept whole. */
    private List<TypeRef> typeRefs(@Nullable TSNode node) {
        var result = new ArrayList<TypeRef>();
        if (node != null) {
            collectTypeRefs(node, result);
        }
        return result;
    }

    private void collectTypeRefs(TSNode node, List<TypeRef> out) {
        var type = node.getType();
        if (NAME.equals(type)
                || QUALIFIED_NAME.equals(type)
                || PRIMITIVE_TYPE.equals(type)
                || RELATIVE_SCOPE.equals(type)
                || "bottom_type".equals(type)) {
            out.add(new TypeRef(text(node), span(node)));
            return;
        }
        for (var child : namedChildren(node)) {
            collectTypeRefs(child, out);
        }
    }

    /** Named operands immediately before and after the first matching operator token. */
    private TSNode[] operandsAround(TSNode node, String... operators) {
        var result = new TSNode[2];
        TSNode operator = null;
        for (int i = 0; i < node.getChildCount() && operator == null; i++) {
            var child = node.getChild(i);
            for (var op : operators) {
                if (op.equals(child.getType())) {
                    operator = child;
                    break;
                }
            }
        }
        if (operator == null) {
            return result;
        }
        for (var child : namedChildren(node)) {
            if (child.getEndByte() <= operator.getStartByte()) {
                result[0] = child;
            } else if (result[1] == null && child.getStartByte() >= operator.getEndByte()) {
                result[1] = child;
            }
        }
        return result;
    }

    private List<PhpNode> convertNamed(TSNode node) {
        var result = new ArrayList<PhpNode>();
        for (var child : namedChildren(node)) {
            result.add(convert(child));
        }
        return result;
    }

    private static List<TSNode> namedChildren(TSNode node) {
        int count = node.getNamedChildCount();
        var result = new ArrayList<TSNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    private static @Nullable TSNode firstChildOfType(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static @Nullable TSNode field(@Nullable TSNode node, String fieldName) {
        if (node == null) {
            return null;
        }
        var child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    private String variableName(TSNode node) {
        var text = text(node);
        return text.startsWith("$") ? text.substring(1) : text;
    }

    private static String stripLeadingSeparator(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    String text(TSNode node) {
        return source.text().substring(source.charOffset(node.getStartByte()), source.charOffset(node.getEndByte()));
    }

    SourceSpan span(TSNode node) {
        return source.spanForBytes(node.getStartByte(), node.getEndByte());
    }
}
