package org.ronjava.backend.bytecode;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ronjava.app.InterpreterOptions;
import org.ronjava.runtime.runtimetypes.RReal;

import static org.junit.jupiter.api.Assertions.*;
import static org.ronjava.TreeBuilder.*;

public class DisassemblerTest {

    private ConstantPool pool;
    private Code code;

    @BeforeEach
    void setUp() {
        pool = new ConstantPool();
        CodeStream stream = new CodeStream();
        int skip = stream.mkLabel();
        code = stream
                .emit(Opcodes.LDVAR, pool.insert("x".intern()))
                .emitBranch(Opcodes.BRFALSE, skip)
                .emit(Opcodes.PUSH, pool.insert(RReal.of(1)))
                .bind(skip)
                .emit(Opcodes.RET)
                .finish(null, pool);
    }

    @Test
    void testListing() {
        String listing = Disassembler.disassemble(code);
        String[] lines = listing.split("\n");
        assertTrue(lines[0].startsWith("Stack length: "), listing);
        assertEquals("   0: ldvar `x`", lines[1]);
        assertEquals("   2: brfalse -> 6", lines[2]);
        assertTrue(lines[3].startsWith("   4: push ["), listing);
        assertEquals("   6: ret", lines[4]);
    }

    @Test
    void testJsonListing() {
        JSONObject root = JSON.parseObject(Disassembler.toJson(code));
        assertEquals(code.stackLength, root.getIntValue("stackLength"));
        JSONArray instructions = root.getJSONArray("instructions");
        assertEquals(4, instructions.size());
        JSONObject branch = instructions.getJSONObject(1);
        assertEquals("brfalse", branch.getString("op"));
        assertEquals(2, branch.getIntValue("pc"));
        assertEquals(6, branch.getJSONArray("imm").getIntValue(0));
        assertNull(instructions.getJSONObject(3).getJSONArray("imm"));
    }

    @Test
    void testFunctionListingNamesEveryCode() {
        InterpreterOptions options = new InterpreterOptions();
        CompiledFunction compiled = new BytecodeCompiler(pool, options)
                .compile(call("f", call("+", sym("a"), num(1))));
        String listing = Disassembler.disassemble(compiled);
        assertTrue(listing.startsWith("=== Function f(a + 1) ==="), listing);
        assertTrue(listing.contains("--- code 0 ---"), listing);
        assertTrue(listing.contains("--- body ---"), listing);
        assertTrue(listing.contains("call (code#0) -"), listing);
    }
}
