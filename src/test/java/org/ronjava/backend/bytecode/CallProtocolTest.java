package org.ronjava.backend.bytecode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ronjava.app.InterpreterOptions;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.analysis.PrintVisitor;
import org.ronjava.runtime.operators.BaseEnvironment;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

import static org.junit.jupiter.api.Assertions.*;
import static org.ronjava.TreeBuilder.*;

public class CallProtocolTest {

    private InterpreterContext ctx;
    private REnvironment creator;
    private REnvironment caller;

    @BeforeEach
    void setUp() {
        ctx = new InterpreterContext(new InterpreterOptions());
        REnvironment base = BaseEnvironment.create();
        creator = new REnvironment(base, "creator");
        caller = new REnvironment(base, "caller");
        creator.define("y", RReal.of(1));
        caller.define("y", RReal.of(2));
    }

    @Test
    void testPromiseOfCallingEnvironmentBecomesItsExpression() {
        Node expression = sym("y");
        RPromise promise = new RPromise(expression, caller);
        assertSame(expression, CallProtocol.valueNode(promise, caller));
    }

    @Test
    void testForeignPromiseKeepsItsEnvironment() {
        RPromise promise = new RPromise(sym("y"), creator);
        Node node = CallProtocol.valueNode(promise, caller);
        assertInstanceOf(ConstantNode.class, node);
        assertEquals("y", PrintVisitor.deparse(node));

        RValue v = BytecodeInterpreter.eval(node, caller, ctx);
        assertEquals(1.0, ((RReal) v).values[0]);
        assertTrue(promise.isForced());
    }

    @Test
    void testForcedPromiseBecomesItsValue() {
        RPromise promise = RPromise.forced(sym("y"), RReal.of(3));
        ConstantNode node = assertInstanceOf(ConstantNode.class, CallProtocol.valueNode(promise, caller));
        assertEquals(3.0, ((RReal) node.value).values[0]);
    }

    @Test
    void testSpecialEvaluatesForeignPromiseWhereItWasMade() {
        ArgumentList args = new ArgumentList().add(new RPromise(sym("y"), creator));
        RValue v = CallProtocol.apply(BaseEnvironment.get("("), args, null, caller, ctx);
        assertEquals(1.0, ((RReal) v).values[0]);
    }

    @Test
    void testSpecialStillReadsSyntaxOfForeignPromise() {
        RList list = new RList(new RValue[]{RReal.of(7)});
        list.setAttribute("names", RString.of("a"));
        ArgumentList args = new ArgumentList().add(list).add(new RPromise(sym("a"), creator));
        RValue v = CallProtocol.apply(BaseEnvironment.get("$"), args, null, caller, ctx);
        assertEquals(7.0, ((RReal) v).values[0]);
    }
}
