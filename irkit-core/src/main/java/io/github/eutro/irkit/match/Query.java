package io.github.eutro.irkit.match;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.OpKind;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Value;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A structural pattern over the IR: variables, and constraints relating them.
 * <p>
 * Matching binds the {@link #ROOT root} variable to the candidate operation, then
 * checks the constraints in the order they were added. A constraint may only read
 * variables bound by earlier constraints. A match succeeds if every constraint holds
 * and every variable ends up bound.
 *
 * <pre>{@code
 * Query query = Query.root(ArithDialect.ADDI);
 * ValueVariable lhs = query.operand(query.getRoot(), "lhs");
 * OperationVariable lhsOp = query.definingOp(lhs);
 * query.hasKind(lhsOp, ArithDialect.CONSTANT);
 * }</pre>
 */
public final class Query {
    /**
     * The name of the variable bound to the operation being matched.
     */
    public static final String ROOT = "root";

    private final Map<String, Variable<?>> variables = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final OperationVariable root;
    private int varId = 0;

    public Query() {
        root = addVariable(new OperationVariable(ROOT));
    }

    /**
     * Create a query whose root is of the given kind.
     *
     * @param kind The kind.
     * @return The query.
     */
    public static Query root(OpKind kind) {
        Query query = new Query();
        query.hasKind(query.root, kind);
        return query;
    }

    /**
     * Create a query whose root is an instance of the given class.
     *
     * @param type The operation class.
     * @return The query.
     */
    public static Query root(Class<? extends Operation> type) {
        Query query = new Query();
        query.addConstraint(new TypeConstraint(query.root, type));
        return query;
    }

    public OperationVariable getRoot() {
        return root;
    }

    public Collection<Variable<?>> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public <V extends Variable<?>> V addVariable(V var) {
        if (variables.putIfAbsent(var.getName(), var) != null) {
            throw new IllegalArgumentException("duplicate variable '" + var.getName() + "'");
        }
        return var;
    }

    public Query addConstraint(Constraint constraint) {
        constraints.add(constraint);
        return this;
    }

    /**
     * Get a fresh id for naming generated variables.
     *
     * @return The id.
     */
    public int nextVarId() {
        return varId++;
    }

    private String freshName(String hint) {
        return hint + "#" + nextVarId();
    }

    public ValueVariable operand(OperationVariable op, String field) {
        ValueVariable var = addVariable(new ValueVariable(freshName(field)));
        addConstraint(new OperationOperandConstraint(op, field, var));
        return var;
    }

    public ValueVariable operand(OperationVariable op, int index) {
        ValueVariable var = addVariable(new ValueVariable(freshName("operand" + index)));
        addConstraint(new OperationOperandConstraint(op, index, var));
        return var;
    }

    public OpResultVariable result(OperationVariable op, String field) {
        OpResultVariable var = addVariable(new OpResultVariable(freshName(field)));
        addConstraint(new OperationResultConstraint(op, field, var));
        return var;
    }

    public OpResultVariable result(OperationVariable op, int index) {
        OpResultVariable var = addVariable(new OpResultVariable(freshName("result" + index)));
        addConstraint(new OperationResultConstraint(op, index, var));
        return var;
    }

    public AttributeVariable attribute(OperationVariable op, String name) {
        AttributeVariable var = addVariable(new AttributeVariable(freshName(name)));
        addConstraint(new OperationAttributeConstraint(op, name, var));
        return var;
    }

    public OperationVariable definingOp(Variable<? extends Value> value) {
        OperationVariable var = addVariable(new OperationVariable(freshName("def")));
        addConstraint(new OpResultOpConstraint(value, var));
        return var;
    }

    public Query hasKind(OperationVariable op, OpKind kind) {
        return addConstraint(new KindConstraint(op, kind));
    }

    public Query attributeEquals(AttributeVariable attr, Attribute value) {
        return addConstraint(new AttributeValueConstraint(attr, value));
    }

    public Query same(Variable<?> lhs, Variable<?> rhs) {
        return addConstraint(new EqConstraint(lhs, rhs));
    }

    /**
     * Match this query with its root bound to {@code op}.
     *
     * @param op The operation.
     * @return The bindings, or empty if the query does not match.
     */
    public Optional<Match> match(Operation op) {
        MatchContext ctx = new MatchContext();
        root.set(ctx, op);
        for (Constraint constraint : constraints) {
            if (!constraint.match(ctx)) return Optional.empty();
        }
        Map<String, Object> bindings = new LinkedHashMap<>();
        for (Variable<?> var : variables.values()) {
            if (!var.isBound(ctx)) return Optional.empty();
            bindings.put(var.getName(), ctx.lookup(var.getName()));
        }
        return Optional.of(new Match(bindings));
    }

    /**
     * Match this query against {@code module} and every operation nested in it, in pre-order.
     * The walk is lazy and starts afresh each time the result is iterated.
     *
     * @param module The root of the walk.
     * @return The matches.
     */
    public Iterable<Match> matches(Operation module) {
        return () -> stream(module).iterator();
    }

    public Stream<Match> stream(Operation module) {
        return StreamSupport.stream(module.preOrder().spliterator(), false)
                .map(this::match)
                .filter(Optional::isPresent)
                .map(Optional::get);
    }

    @Override
    public String toString() {
        return "Query" + constraints;
    }
}
