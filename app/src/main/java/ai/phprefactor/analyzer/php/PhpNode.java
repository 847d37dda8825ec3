package ai.phprefactor.analyzer.php;

import ai.phprefactor.analyzer.SourceSpan;
import ai.phprefactor.analyzer.SymbolKind;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Normalized PHP syntax tree. Only the node kinds the index, the scope tracker and the edit planner consume get their
 * own variant; everything else is an {@link Other} carrying its converted children so generic walks still reach
 * nested references.
 */
public sealed interface PhpNode {
    SourceSpan span();

    /** The child slots a generic walk descends into. */
    List<PhpNode> children();

    void accept(PhpNodeVisitor visitor);

    enum FunctionKind {
        METHOD,
        FUNCTION,
        CLOSURE,
        ARROW_FUNCTION
    }

    enum UseKind {
        CLASS,
        FUNCTION,
        CONSTANT
    }

    record Program(SourceSpan span, List<PhpNode> children) implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitProgram(this);
        }
    }

    /**
     * @param span for the statement form {@code namespace A\B;} the span runs through the semicolon; for the braced form
     *     it covers the whole block
     * @param nameSpan absent for the anonymous global namespace block
     */
    record Namespace(String name, @Nullable SourceSpan nameSpan, SourceSpan span, boolean braced, List<PhpNode> children)
            implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitNamespace(this);
        }
    }

    record ClassLike(
            SymbolKind kind,
            String name,
            SourceSpan nameSpan,
            SourceSpan span,
            List<TypeRef> extendsTypes,
            List<TypeRef> implementsTypes,
            List<PhpNode> members)
            implements PhpNode {
        @Override
        public List<PhpNode> children() {
            return members;
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitClassLike(this);
        }
    }

    record FunctionLike(
            FunctionKind kind,
            @Nullable String name,
            @Nullable SourceSpan nameSpan,
            SourceSpan span,
            List<Parameter> parameters,
            List<TypeRef> returnTypes,
            List<PhpNode> body)
            implements PhpNode {
        @Override
        public List<PhpNode> children() {
            var all = new ArrayList<PhpNode>(parameters.size() + body.size());
            all.addAll(parameters);
            all.addAll(body);
            return all;
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitFunctionLike(this);
        }
    }

    /** @param name variable name without the leading {@code $} */
    record Parameter(String name, List<TypeRef> types, boolean promoted, SourceSpan span, List<PhpNode> children)
            implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitParameter(this);
        }
    }

    record PropertyDeclaration(List<String> names, List<TypeRef> types, SourceSpan span, List<PhpNode> children)
            implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitPropertyDeclaration(this);
        }
    }

    /** @param type absent for {@code new $className} and anonymous classes */
    record NewExpression(@Nullable TypeRef type, SourceSpan span, List<PhpNode> children) implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitNewExpression(this);
        }
    }

    record PropertyLookup(PhpNode object, String property, SourceSpan nameSpan, SourceSpan span) implements PhpNode {
        @Override
        public List<PhpNode> children() {
            return List.of(object);
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitPropertyLookup(this);
        }
    }

    record MethodCall(
            PhpNode receiver, String methodName, SourceSpan nameSpan, SourceSpan span, List<PhpNode> arguments)
            implements PhpNode {
        @Override
        public List<PhpNode> children() {
            var all = new ArrayList<PhpNode>(arguments.size() + 1);
            all.add(receiver);
            all.addAll(arguments);
            return all;
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitMethodCall(this);
        }
    }

    /** @param scope absent when the scope is an expression such as {@code $class::create()} */
    record StaticCall(
            @Nullable TypeRef scope, String methodName, SourceSpan nameSpan, SourceSpan span, List<PhpNode> children)
            implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitStaticCall(this);
        }
    }

    /** Class constant or static property access. */
    record StaticLookup(@Nullable TypeRef scope, String member, SourceSpan span, List<PhpNode> children)
            implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitStaticLookup(this);
        }
    }

    /** @param groupPrefix the shared prefix of a {@code use A\{B, C}} statement, if grouped */
    record UseDeclaration(UseKind kind, List<UseClause> clauses, @Nullable String groupPrefix, SourceSpan span)
            implements PhpNode {
        @Override
        public List<PhpNode> children() {
            return List.of();
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitUseDeclaration(this);
        }
    }

    record Assignment(PhpNode target, PhpNode value, SourceSpan span) implements PhpNode {
        @Override
        public List<PhpNode> children() {
            return List.of(target, value);
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitAssignment(this);
        }
    }

    /** @param name without the leading {@code $}; {@code this} for {@code $this} */
    record Variable(String name, SourceSpan span) implements PhpNode {
        @Override
        public List<PhpNode> children() {
            return List.of();
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitVariable(this);
        }

        public boolean isThis() {
            return "this".equals(name);
        }
    }

    /** A bare or qualified name outside the typed slots above: function calls, constants, catch types and so on. */
    record NameReference(TypeRef name) implements PhpNode {
        @Override
        public SourceSpan span() {
            return name.span();
        }

        @Override
        public List<PhpNode> children() {
            return List.of();
        }

        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitNameReference(this);
        }
    }

    record Block(SourceSpan span, List<PhpNode> children) implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitBlock(this);
        }
    }

    record Other(String type, SourceSpan span, List<PhpNode> children) implements PhpNode {
        @Override
        public void accept(PhpNodeVisitor visitor) {
            visitor.visitOther(this);
        }
    }
}
