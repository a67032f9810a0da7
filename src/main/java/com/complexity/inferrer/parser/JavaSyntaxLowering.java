package com.complexity.inferrer.parser;

import com.complexity.inferrer.ast.Attribute;
import com.complexity.inferrer.ast.AugmentedAssign;
import com.complexity.inferrer.ast.BinaryOp;
import com.complexity.inferrer.ast.Call;
import com.complexity.inferrer.ast.Comprehension;
import com.complexity.inferrer.ast.ComprehensionClause;
import com.complexity.inferrer.ast.Constant;
import com.complexity.inferrer.ast.ContainerLiteral;
import com.complexity.inferrer.ast.ForLoop;
import com.complexity.inferrer.ast.FunctionDef;
import com.complexity.inferrer.ast.IfStmt;
import com.complexity.inferrer.ast.Name;
import com.complexity.inferrer.ast.Operator;
import com.complexity.inferrer.ast.OtherNode;
import com.complexity.inferrer.ast.Parameter;
import com.complexity.inferrer.ast.Return;
import com.complexity.inferrer.ast.Snippet;
import com.complexity.inferrer.ast.SyntaxNode;
import com.complexity.inferrer.ast.WhileLoop;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a JavaParser tree to the engine's {@link SyntaxNode} model, mapping
 * Java idioms onto the recognized constructs:
 * <ul>
 *   <li>counting {@code for} loops become loops over {@code range(start, end[, step])};</li>
 *   <li>other {@code for} loops, {@code while} and {@code do} become while loops;</li>
 *   <li>integer {@code /} becomes floor division, {@code >>} and {@code >>>} right shift;</li>
 *   <li>collection constructors, {@code List.of} and array creation become container literals;</li>
 *   <li>stream pipelines become comprehensions;</li>
 *   <li>overloads that only forward literal arguments become parameter defaults.</li>
 * </ul>
 */
public class JavaSyntaxLowering {

    private static final Logger logger = LoggerFactory.getLogger(JavaSyntaxLowering.class);

    private static final Set<String> STREAM_TERMINALS = Set.of(
            "collect", "toList", "toArray", "forEach", "sum", "count", "average", "max", "min",
            "anyMatch", "allMatch", "noneMatch", "reduce", "findFirst", "findAny");

    private static final Set<String> NUMERIC_STREAMS = Set.of("IntStream", "LongStream");

    private static final String STREAM_ELEMENT = "element";

    public Snippet lower(Node root) {
        List<SyntaxNode> body = new ArrayList<>();
        if (root instanceof CompilationUnit) {
            for (TypeDeclaration<?> type : ((CompilationUnit) root).getTypes()) {
                body.addAll(lowerType(type));
            }
        } else if (root instanceof Statement) {
            body.addAll(lowerStatement((Statement) root));
        } else if (root instanceof Expression) {
            body.add(lowerExpression((Expression) root));
        } else {
            body.addAll(lowerChildren(root));
        }
        return new Snippet(body);
    }

    // ---- declarations -------------------------------------------------

    private List<SyntaxNode> lowerType(TypeDeclaration<?> type) {
        List<MethodDeclaration> methods = new ArrayList<>();
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration) {
                methods.add((MethodDeclaration) member);
            }
        }

        Set<MethodDeclaration> forwarders = new HashSet<>();
        Map<MethodDeclaration, Map<String, Constant>> defaults = foldForwardingOverloads(methods, forwarders);

        List<SyntaxNode> members = new ArrayList<>();
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration) {
                MethodDeclaration method = (MethodDeclaration) member;
                if (!forwarders.contains(method)) {
                    members.add(lowerMethod(method, defaults.getOrDefault(method, Map.of())));
                }
            } else if (member instanceof ConstructorDeclaration) {
                ConstructorDeclaration constructor = (ConstructorDeclaration) member;
                members.add(new FunctionDef(constructor.getNameAsString(),
                        lowerParameters(constructor.getParameters(), Map.of()),
                        lowerStatement(constructor.getBody())));
            } else if (member instanceof InitializerDeclaration) {
                members.addAll(lowerStatement(((InitializerDeclaration) member).getBody()));
            } else if (member instanceof FieldDeclaration) {
                List<SyntaxNode> initializers = new ArrayList<>();
                for (VariableDeclarator variable : ((FieldDeclaration) member).getVariables()) {
                    variable.getInitializer().ifPresent(init -> initializers.add(lowerExpression(init)));
                }
                if (!initializers.isEmpty()) {
                    members.add(new OtherNode("Field", initializers));
                }
            } else if (member instanceof TypeDeclaration) {
                members.addAll(lowerType((TypeDeclaration<?>) member));
            } else {
                members.addAll(lowerChildren(member));
            }
        }
        return List.of(new OtherNode("Type " + type.getNameAsString(), members));
    }

    /**
     * Finds overloads of the form {@code f(a) { return f(a, 1); }} that only
     * forward to a longer overload with literal trailing arguments. The
     * forwarders are collected into {@code forwarders}; the returned map gives
     * the literal defaults per target overload.
     */
    private Map<MethodDeclaration, Map<String, Constant>> foldForwardingOverloads(
            List<MethodDeclaration> methods, Set<MethodDeclaration> forwarders) {
        Map<MethodDeclaration, Map<String, Constant>> defaults = new LinkedHashMap<>();

        for (MethodDeclaration method : methods) {
            Optional<MethodCallExpr> forwardCall = singleForwardingCall(method);
            if (forwardCall.isEmpty()) {
                continue;
            }
            MethodCallExpr call = forwardCall.get();
            int ownArity = method.getParameters().size();
            int targetArity = call.getArguments().size();

            Optional<MethodDeclaration> target = methods.stream()
                    .filter(candidate -> candidate != method)
                    .filter(candidate -> candidate.getNameAsString().equals(method.getNameAsString()))
                    .filter(candidate -> candidate.getParameters().size() == targetArity)
                    .findFirst();
            if (target.isEmpty() || targetArity <= ownArity) {
                continue;
            }

            boolean passesOwnParameters = true;
            for (int i = 0; i < ownArity; i++) {
                Expression argument = call.getArgument(i);
                if (!(argument.isNameExpr()
                        && argument.asNameExpr().getNameAsString().equals(method.getParameter(i).getNameAsString()))) {
                    passesOwnParameters = false;
                    break;
                }
            }
            if (!passesOwnParameters) {
                continue;
            }

            Map<String, Constant> literals = new LinkedHashMap<>();
            for (int i = ownArity; i < targetArity; i++) {
                SyntaxNode lowered = lowerExpression(call.getArgument(i));
                if (!(lowered instanceof Constant)) {
                    literals = null;
                    break;
                }
                literals.put(target.get().getParameter(i).getNameAsString(), (Constant) lowered);
            }
            if (literals == null) {
                continue;
            }

            logger.debug("Folding forwarding overload {}/{} into defaults of {}/{}",
                    method.getNameAsString(), ownArity, method.getNameAsString(), targetArity);
            forwarders.add(method);
            Map<String, Constant> targetDefaults = defaults.computeIfAbsent(target.get(), k -> new LinkedHashMap<>());
            literals.forEach(targetDefaults::putIfAbsent);
        }
        return defaults;
    }

    private static Optional<MethodCallExpr> singleForwardingCall(MethodDeclaration method) {
        Optional<BlockStmt> body = method.getBody();
        if (body.isEmpty() || body.get().getStatements().size() != 1) {
            return Optional.empty();
        }
        Statement statement = body.get().getStatement(0);
        Optional<Expression> expression = Optional.empty();
        if (statement.isExpressionStmt()) {
            expression = Optional.of(statement.asExpressionStmt().getExpression());
        } else if (statement.isReturnStmt()) {
            expression = statement.asReturnStmt().getExpression();
        }
        return expression
                .filter(Expression::isMethodCallExpr)
                .map(Expression::asMethodCallExpr)
                .filter(call -> call.getNameAsString().equals(method.getNameAsString()))
                .filter(call -> call.getScope().isEmpty() || call.getScope().get().isThisExpr());
    }

    private FunctionDef lowerMethod(MethodDeclaration method, Map<String, Constant> defaults) {
        List<SyntaxNode> body = method.getBody()
                .map(this::lowerStatement)
                .orElse(List.of());
        return new FunctionDef(method.getNameAsString(), lowerParameters(method.getParameters(), defaults), body);
    }

    private static List<Parameter> lowerParameters(List<com.github.javaparser.ast.body.Parameter> parameters,
                                                   Map<String, Constant> defaults) {
        List<Parameter> lowered = new ArrayList<>();
        for (com.github.javaparser.ast.body.Parameter parameter : parameters) {
            String name = parameter.getNameAsString();
            lowered.add(new Parameter(name, defaults.get(name)));
        }
        return lowered;
    }

    // ---- statements ---------------------------------------------------

    private List<SyntaxNode> lowerStatement(Statement statement) {
        if (statement instanceof BlockStmt) {
            List<SyntaxNode> lowered = new ArrayList<>();
            for (Statement inner : ((BlockStmt) statement).getStatements()) {
                lowered.addAll(lowerStatement(inner));
            }
            return lowered;
        }
        if (statement instanceof ExpressionStmt) {
            return List.of(lowerExpression(((ExpressionStmt) statement).getExpression()));
        }
        if (statement instanceof ForEachStmt) {
            ForEachStmt forEach = (ForEachStmt) statement;
            return List.of(new ForLoop(lowerIterable(forEach.getIterable()), lowerStatement(forEach.getBody())));
        }
        if (statement instanceof ForStmt) {
            return lowerFor((ForStmt) statement);
        }
        if (statement instanceof WhileStmt) {
            WhileStmt whileStmt = (WhileStmt) statement;
            return List.of(new WhileLoop(lowerExpression(whileStmt.getCondition()), lowerStatement(whileStmt.getBody())));
        }
        if (statement instanceof DoStmt) {
            DoStmt doStmt = (DoStmt) statement;
            return List.of(new WhileLoop(lowerExpression(doStmt.getCondition()), lowerStatement(doStmt.getBody())));
        }
        if (statement instanceof com.github.javaparser.ast.stmt.IfStmt) {
            com.github.javaparser.ast.stmt.IfStmt ifStmt = (com.github.javaparser.ast.stmt.IfStmt) statement;
            List<SyntaxNode> elseBody = ifStmt.getElseStmt()
                    .map(this::lowerStatement)
                    .orElse(List.of());
            return List.of(new IfStmt(lowerExpression(ifStmt.getCondition()),
                    lowerStatement(ifStmt.getThenStmt()), elseBody));
        }
        if (statement instanceof ReturnStmt) {
            return List.of(((ReturnStmt) statement).getExpression()
                    .map(value -> new Return(lowerExpression(value)))
                    .orElseGet(Return::new));
        }
        if (statement instanceof LocalClassDeclarationStmt) {
            return lowerType(((LocalClassDeclarationStmt) statement).getClassDeclaration());
        }
        if (statement instanceof EmptyStmt) {
            return List.of();
        }
        return List.of(new OtherNode(statement.getClass().getSimpleName(), lowerChildren(statement)));
    }

    /**
     * A counting loop {@code for (i = a; i < b; i++)} becomes a loop over
     * {@code range(a, b)}; a {@code i * i <= n} condition gives the bound
     * {@code isqrt(n)}. Anything else becomes its initialization followed by a
     * while loop whose body ends with the update.
     */
    private List<SyntaxNode> lowerFor(ForStmt forStmt) {
        Optional<SyntaxNode> range = countingRange(forStmt);
        if (range.isPresent()) {
            return List.of(new ForLoop(range.get(), lowerStatement(forStmt.getBody())));
        }

        List<SyntaxNode> lowered = new ArrayList<>();
        for (Expression init : forStmt.getInitialization()) {
            lowered.add(lowerExpression(init));
        }
        List<SyntaxNode> body = new ArrayList<>(lowerStatement(forStmt.getBody()));
        for (Expression update : forStmt.getUpdate()) {
            body.add(lowerExpression(update));
        }
        SyntaxNode condition = forStmt.getCompare()
                .map(this::lowerExpression)
                .orElseGet(() -> new Constant(Boolean.TRUE));
        lowered.add(new WhileLoop(condition, body));
        return lowered;
    }

    private Optional<SyntaxNode> countingRange(ForStmt forStmt) {
        if (forStmt.getInitialization().size() != 1 || forStmt.getUpdate().size() != 1
                || forStmt.getCompare().isEmpty()) {
            return Optional.empty();
        }

        String variable = null;
        Expression start = null;
        Expression init = forStmt.getInitialization().get(0);
        if (init.isVariableDeclarationExpr() && init.asVariableDeclarationExpr().getVariables().size() == 1) {
            VariableDeclarator declarator = init.asVariableDeclarationExpr().getVariable(0);
            variable = declarator.getNameAsString();
            start = declarator.getInitializer().orElse(null);
        } else if (init.isAssignExpr() && init.asAssignExpr().getOperator() == AssignExpr.Operator.ASSIGN
                && init.asAssignExpr().getTarget().isNameExpr()) {
            variable = init.asAssignExpr().getTarget().asNameExpr().getNameAsString();
            start = init.asAssignExpr().getValue();
        }
        if (variable == null || start == null) {
            return Optional.empty();
        }

        Optional<Long> step = stepOf(forStmt.getUpdate().get(0), variable);
        if (step.isEmpty() || step.get() == 0) {
            return Optional.empty();
        }

        Expression compare = unwrap(forStmt.getCompare().get());
        if (!compare.isBinaryExpr()) {
            return Optional.empty();
        }
        BinaryExpr comparison = compare.asBinaryExpr();
        BinaryExpr.Operator operator = comparison.getOperator();
        boolean inclusive = operator == BinaryExpr.Operator.LESS_EQUALS || operator == BinaryExpr.Operator.GREATER_EQUALS;
        boolean ordering = inclusive || operator == BinaryExpr.Operator.LESS || operator == BinaryExpr.Operator.GREATER;
        if (!ordering) {
            return Optional.empty();
        }

        Expression left = unwrap(comparison.getLeft());
        SyntaxNode end;
        if (isName(left, variable)) {
            end = lowerExpression(comparison.getRight());
            if (inclusive && end instanceof Constant && ((Constant) end).isIntegral()) {
                long bound = ((Constant) end).asLong().getAsLong();
                end = new Constant(step.get() > 0 ? bound + 1 : bound - 1);
            }
        } else if (isSquareOf(left, variable) && !(operator == BinaryExpr.Operator.GREATER
                || operator == BinaryExpr.Operator.GREATER_EQUALS)) {
            end = new Call(new Name("isqrt"), List.of(lowerExpression(comparison.getRight())));
        } else {
            return Optional.empty();
        }

        List<SyntaxNode> arguments = new ArrayList<>();
        arguments.add(lowerExpression(start));
        arguments.add(end);
        if (step.get() != 1) {
            arguments.add(new Constant(step.get()));
        }
        return Optional.of(new Call(new Name("range"), arguments));
    }

    /**
     * Literal step of {@code i++}, {@code i--}, {@code i += c} or {@code i -= c}.
     */
    private static Optional<Long> stepOf(Expression update, String variable) {
        if (update.isUnaryExpr() && isName(update.asUnaryExpr().getExpression(), variable)) {
            switch (update.asUnaryExpr().getOperator()) {
                case POSTFIX_INCREMENT:
                case PREFIX_INCREMENT:
                    return Optional.of(1L);
                case POSTFIX_DECREMENT:
                case PREFIX_DECREMENT:
                    return Optional.of(-1L);
                default:
                    return Optional.empty();
            }
        }
        if (update.isAssignExpr() && isName(update.asAssignExpr().getTarget(), variable)) {
            AssignExpr assign = update.asAssignExpr();
            Optional<Long> amount = integerLiteral(assign.getValue());
            if (amount.isEmpty()) {
                return Optional.empty();
            }
            if (assign.getOperator() == AssignExpr.Operator.PLUS) {
                return amount;
            }
            if (assign.getOperator() == AssignExpr.Operator.MINUS) {
                return Optional.of(-amount.get());
            }
        }
        return Optional.empty();
    }

    // ---- expressions --------------------------------------------------

    /**
     * For-each iterables: {@code x.toCharArray()} and {@code x.chars()} over a
     * computed string iterate that string, so the conversion call itself is
     * the iterable.
     */
    private SyntaxNode lowerIterable(Expression iterable) {
        Expression expression = unwrap(iterable);
        if (expression.isMethodCallExpr()) {
            MethodCallExpr call = expression.asMethodCallExpr();
            String name = call.getNameAsString();
            if ((name.equals("toCharArray") || name.equals("chars")) && call.getArguments().isEmpty()
                    && call.getScope().isPresent() && call.getScope().get().isMethodCallExpr()) {
                return lowerExpression(call.getScope().get());
            }
        }
        return lowerExpression(expression);
    }

    SyntaxNode lowerExpression(Expression expression) {
        if (expression instanceof EnclosedExpr) {
            return lowerExpression(((EnclosedExpr) expression).getInner());
        }
        if (expression instanceof NameExpr) {
            return new Name(((NameExpr) expression).getNameAsString());
        }
        if (expression instanceof ThisExpr) {
            return new Name("this");
        }
        if (expression instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) expression;
            return new Attribute(lowerExpression(access.getScope()), access.getNameAsString());
        }
        if (expression instanceof LiteralExpr) {
            return lowerLiteral((LiteralExpr) expression);
        }
        if (expression instanceof UnaryExpr) {
            return lowerUnary((UnaryExpr) expression);
        }
        if (expression instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expression;
            return new BinaryOp(binaryOperator(binary.getOperator(), binary.getLeft(), binary.getRight()),
                    lowerExpression(binary.getLeft()), lowerExpression(binary.getRight()));
        }
        if (expression instanceof AssignExpr) {
            return lowerAssign((AssignExpr) expression);
        }
        if (expression instanceof MethodCallExpr) {
            return lowerMethodCall((MethodCallExpr) expression);
        }
        if (expression instanceof ObjectCreationExpr) {
            return lowerObjectCreation((ObjectCreationExpr) expression);
        }
        if (expression instanceof ArrayCreationExpr) {
            ArrayCreationExpr creation = (ArrayCreationExpr) expression;
            if (creation.getInitializer().isPresent()) {
                return lowerExpression(creation.getInitializer().get());
            }
            List<SyntaxNode> dimensions = new ArrayList<>();
            creation.getLevels().forEach(level ->
                    level.getDimension().ifPresent(dimension -> dimensions.add(lowerExpression(dimension))));
            return new ContainerLiteral(ContainerLiteral.Kind.LIST, dimensions);
        }
        if (expression instanceof ArrayInitializerExpr) {
            return new ContainerLiteral(ContainerLiteral.Kind.LIST,
                    lowerAll(((ArrayInitializerExpr) expression).getValues()));
        }
        if (expression instanceof LambdaExpr) {
            return new OtherNode("Lambda", lowerStatement(((LambdaExpr) expression).getBody()));
        }
        return new OtherNode(expression.getClass().getSimpleName(), lowerChildren(expression));
    }

    private static SyntaxNode lowerLiteral(LiteralExpr literal) {
        if (literal instanceof IntegerLiteralExpr) {
            return new Constant(((IntegerLiteralExpr) literal).asNumber());
        }
        if (literal instanceof LongLiteralExpr) {
            return new Constant(((LongLiteralExpr) literal).asNumber());
        }
        if (literal instanceof DoubleLiteralExpr) {
            return new Constant(((DoubleLiteralExpr) literal).asDouble());
        }
        if (literal instanceof BooleanLiteralExpr) {
            return new Constant(((BooleanLiteralExpr) literal).getValue());
        }
        if (literal instanceof CharLiteralExpr) {
            return new Constant(((CharLiteralExpr) literal).asChar());
        }
        if (literal instanceof StringLiteralExpr) {
            return new Constant(((StringLiteralExpr) literal).asString());
        }
        if (literal instanceof TextBlockLiteralExpr) {
            return new Constant(((TextBlockLiteralExpr) literal).asString());
        }
        return new Constant(null);
    }

    private SyntaxNode lowerUnary(UnaryExpr unary) {
        SyntaxNode operand = lowerExpression(unary.getExpression());
        if (operand instanceof Constant && ((Constant) operand).isNumeric()) {
            Constant constant = (Constant) operand;
            if (unary.getOperator() == UnaryExpr.Operator.MINUS) {
                return constant.isIntegral()
                        ? new Constant(-constant.asLong().getAsLong())
                        : new Constant(-constant.asDouble());
            }
            if (unary.getOperator() == UnaryExpr.Operator.PLUS) {
                return constant;
            }
        }
        return new OtherNode("Unary " + unary.getOperator().asString(), List.of(operand));
    }

    private SyntaxNode lowerAssign(AssignExpr assign) {
        SyntaxNode target = lowerExpression(assign.getTarget());
        SyntaxNode value = lowerExpression(assign.getValue());
        switch (assign.getOperator()) {
            case ASSIGN:
                return new OtherNode("Assign", List.of(target, value));
            case DIVIDE:
                return new AugmentedAssign(isFloating(assign.getValue()) ? Operator.DIVIDE : Operator.FLOOR_DIV,
                        target, value);
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return new AugmentedAssign(Operator.RIGHT_SHIFT, target, value);
            default:
                return new AugmentedAssign(Operator.OTHER, target, value);
        }
    }

    private static Operator binaryOperator(BinaryExpr.Operator operator, Expression left, Expression right) {
        switch (operator) {
            case DIVIDE:
                return isFloating(left) || isFloating(right) ? Operator.DIVIDE : Operator.FLOOR_DIV;
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return Operator.RIGHT_SHIFT;
            default:
                return Operator.OTHER;
        }
    }

    private SyntaxNode lowerMethodCall(MethodCallExpr call) {
        Optional<SyntaxNode> comprehension = lowerStreamPipeline(call);
        if (comprehension.isPresent()) {
            return comprehension.get();
        }

        String name = call.getNameAsString();
        String owner = call.getScope()
                .filter(Expression::isNameExpr)
                .map(scope -> scope.asNameExpr().getNameAsString())
                .orElse("");

        if (owner.equals("Math") && name.equals("pow") && call.getArguments().size() == 2) {
            return new BinaryOp(Operator.POWER, lowerExpression(call.getArgument(0)), lowerExpression(call.getArgument(1)));
        }
        if ((owner.equals("List") && name.equals("of")) || (owner.equals("Arrays") && name.equals("asList"))) {
            return new ContainerLiteral(ContainerLiteral.Kind.LIST, lowerAll(call.getArguments()));
        }
        if (owner.equals("Set") && name.equals("of")) {
            return new ContainerLiteral(ContainerLiteral.Kind.SET, lowerAll(call.getArguments()));
        }
        if (owner.equals("Map") && (name.equals("of") || name.equals("ofEntries"))) {
            return new ContainerLiteral(ContainerLiteral.Kind.DICT, lowerAll(call.getArguments()));
        }
        return lowerPlainCall(call);
    }

    private SyntaxNode lowerPlainCall(MethodCallExpr call) {
        SyntaxNode callee;
        if (call.getScope().isEmpty() || call.getScope().get().isThisExpr()) {
            callee = new Name(call.getNameAsString());
        } else {
            callee = new Attribute(lowerExpression(call.getScope().get()), call.getNameAsString());
        }
        return new Call(callee, lowerAll(call.getArguments()));
    }

    /**
     * A stream pipeline ending in a terminal operation becomes a comprehension
     * over the stream's source. {@code collect} with a list, set or map
     * collector, {@code toList} and {@code toArray} materialize a container;
     * other terminals are lazy.
     */
    private Optional<SyntaxNode> lowerStreamPipeline(MethodCallExpr terminal) {
        if (!STREAM_TERMINALS.contains(terminal.getNameAsString())) {
            return Optional.empty();
        }
        Optional<SyntaxNode> source = Optional.empty();
        List<MethodCallExpr> intermediates = new ArrayList<>();
        Optional<Expression> scope = terminal.getScope();
        while (scope.isPresent() && scope.get().isMethodCallExpr() && source.isEmpty()) {
            MethodCallExpr link = scope.get().asMethodCallExpr();
            source = streamSource(link);
            if (source.isEmpty()) {
                intermediates.add(0, link);
            }
            scope = link.getScope();
        }
        if (source.isEmpty()) {
            return Optional.empty();
        }

        Comprehension.Kind kind = pipelineKind(terminal);
        logger.debug("Lowering stream pipeline ending in {} as {} comprehension", terminal.getNameAsString(), kind);
        return Optional.of(new Comprehension(kind,
                List.of(new ComprehensionClause(source.get())),
                pipelineElement(intermediates, terminal)));
    }

    /**
     * The per-element work of a pipeline: its intermediate operations and
     * terminal chained on a placeholder element. The source is lowered once,
     * as the clause iterable.
     */
    private SyntaxNode pipelineElement(List<MethodCallExpr> intermediates, MethodCallExpr terminal) {
        SyntaxNode element = new Name(STREAM_ELEMENT);
        for (MethodCallExpr operation : intermediates) {
            element = new Call(new Attribute(element, operation.getNameAsString()), lowerAll(operation.getArguments()));
        }
        return new Call(new Attribute(element, terminal.getNameAsString()), lowerAll(terminal.getArguments()));
    }

    private Optional<SyntaxNode> streamSource(MethodCallExpr link) {
        String name = link.getNameAsString();
        Optional<Expression> scope = link.getScope();
        String owner = scope.filter(Expression::isNameExpr)
                .map(expression -> expression.asNameExpr().getNameAsString())
                .orElse("");

        if ((name.equals("stream") || name.equals("parallelStream")) && link.getArguments().isEmpty()
                && scope.isPresent()) {
            return Optional.of(lowerExpression(scope.get()));
        }
        if (owner.equals("Arrays") && name.equals("stream") && !link.getArguments().isEmpty()) {
            return Optional.of(lowerExpression(link.getArgument(0)));
        }
        if (NUMERIC_STREAMS.contains(owner) && link.getArguments().size() == 2
                && (name.equals("range") || name.equals("rangeClosed"))) {
            SyntaxNode start = lowerExpression(link.getArgument(0));
            SyntaxNode end = lowerExpression(link.getArgument(1));
            if (name.equals("rangeClosed") && end instanceof Constant && ((Constant) end).isIntegral()) {
                end = new Constant(((Constant) end).asLong().getAsLong() + 1);
            }
            return Optional.of(new Call(new Name("range"), List.of(start, end)));
        }
        if (owner.equals("Stream") && name.equals("of")) {
            return Optional.of(new ContainerLiteral(ContainerLiteral.Kind.LIST, lowerAll(link.getArguments())));
        }
        return Optional.empty();
    }

    private static Comprehension.Kind pipelineKind(MethodCallExpr terminal) {
        String name = terminal.getNameAsString();
        if (name.equals("toList") || name.equals("toArray")) {
            return Comprehension.Kind.LIST;
        }
        if (!name.equals("collect") || terminal.getArguments().isEmpty()) {
            return Comprehension.Kind.GENERATOR;
        }
        Expression collector = unwrap(terminal.getArgument(0));
        String collectorName = collector.isMethodCallExpr() ? collector.asMethodCallExpr().getNameAsString() : "";
        return switch (collectorName) {
            case "toList", "toUnmodifiableList", "toCollection" -> Comprehension.Kind.LIST;
            case "toSet", "toUnmodifiableSet" -> Comprehension.Kind.SET;
            case "toMap", "toUnmodifiableMap", "groupingBy", "partitioningBy" -> Comprehension.Kind.DICT;
            default -> Comprehension.Kind.GENERATOR;
        };
    }

    /**
     * {@code new ArrayList<>()} and friends are growable containers; other
     * constructor calls are plain calls on the type name.
     */
    private SyntaxNode lowerObjectCreation(ObjectCreationExpr creation) {
        String typeName = creation.getType().getNameAsString();
        List<SyntaxNode> arguments = lowerAll(creation.getArguments());
        Optional<ContainerLiteral.Kind> kind = containerKindOf(typeName);
        if (kind.isPresent()) {
            return new ContainerLiteral(kind.get(), arguments, true);
        }
        return new Call(new Name(typeName), arguments);
    }

    private static Optional<ContainerLiteral.Kind> containerKindOf(String typeName) {
        if (typeName.contains("Map")) {
            return Optional.of(ContainerLiteral.Kind.DICT);
        }
        if (typeName.contains("Set")) {
            return Optional.of(ContainerLiteral.Kind.SET);
        }
        if (typeName.contains("List") || typeName.contains("Deque") || typeName.contains("Queue")
                || typeName.contains("Stack") || typeName.contains("Vector")) {
            return Optional.of(ContainerLiteral.Kind.LIST);
        }
        return Optional.empty();
    }

    // ---- helpers ------------------------------------------------------

    private List<SyntaxNode> lowerAll(List<Expression> expressions) {
        List<SyntaxNode> lowered = new ArrayList<>();
        for (Expression expression : expressions) {
            lowered.add(lowerExpression(expression));
        }
        return lowered;
    }

    /**
     * Lowers the statements and expressions under a construct that has no
     * dedicated mapping (try, switch, synchronized, casts...). Names, types,
     * modifiers, annotations and comments carry no complexity signal and are
     * dropped.
     */
    private List<SyntaxNode> lowerChildren(Node node) {
        List<SyntaxNode> lowered = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (isInert(child)) {
                continue;
            }
            if (child instanceof Statement) {
                lowered.addAll(lowerStatement((Statement) child));
            } else if (child instanceof Expression) {
                lowered.add(lowerExpression((Expression) child));
            } else if (child instanceof TypeDeclaration) {
                lowered.addAll(lowerType((TypeDeclaration<?>) child));
            } else {
                lowered.addAll(lowerChildren(child));
            }
        }
        return lowered;
    }

    private static boolean isInert(Node node) {
        return node instanceof Type || node instanceof SimpleName
                || node instanceof com.github.javaparser.ast.expr.Name || node instanceof Modifier
                || node instanceof AnnotationExpr || node instanceof Comment
                || node instanceof ImportDeclaration || node instanceof PackageDeclaration;
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (current.isEnclosedExpr()) {
            current = current.asEnclosedExpr().getInner();
        }
        return current;
    }

    private static boolean isName(Expression expression, String variable) {
        Expression unwrapped = unwrap(expression);
        return unwrapped.isNameExpr() && unwrapped.asNameExpr().getNameAsString().equals(variable);
    }

    private static boolean isSquareOf(Expression expression, String variable) {
        return expression.isBinaryExpr()
                && expression.asBinaryExpr().getOperator() == BinaryExpr.Operator.MULTIPLY
                && isName(expression.asBinaryExpr().getLeft(), variable)
                && isName(expression.asBinaryExpr().getRight(), variable);
    }

    private static boolean isFloating(Expression expression) {
        Expression unwrapped = unwrap(expression);
        if (unwrapped.isDoubleLiteralExpr()) {
            return true;
        }
        return unwrapped.isCastExpr()
                && (unwrapped.asCastExpr().getType().asString().equals("double")
                || unwrapped.asCastExpr().getType().asString().equals("float"));
    }

    private static Optional<Long> integerLiteral(Expression expression) {
        Expression unwrapped = unwrap(expression);
        if (unwrapped.isIntegerLiteralExpr()) {
            return Optional.of(unwrapped.asIntegerLiteralExpr().asNumber().longValue());
        }
        if (unwrapped.isLongLiteralExpr()) {
            return Optional.of(unwrapped.asLongLiteralExpr().asNumber().longValue());
        }
        return Optional.empty();
    }
}
