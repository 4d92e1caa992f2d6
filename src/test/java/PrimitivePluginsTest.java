import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.scheep.script.Scheep;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

public class PrimitivePluginsTest {

    private static Value run(String src) {
        return new Scheep().run(src);
    }

    private static EvaluationException.Kind failureKind(String src) {
        Scheep es = new Scheep();
        return assertThrows(EvaluationException.class, () -> es.run(src)).getKind();
    }

    @Test
    void arithmetic() {
        assertEquals(Value.number(6), run("(+ 1 2 3)"));
        assertEquals(Value.number(0), run("(+)"));
        assertEquals(Value.number(1), run("(*)"));
        assertEquals(Value.number(-10), run("(- 10)"));
        assertEquals(Value.number(5), run("(- 10 3 2)"));
        assertEquals(Value.number(2.5), run("(/ 5 2)"));
        assertEquals(Value.number(0.5), run("(/ 2)"));
    }

    @Test
    void comparisonsChain() {
        assertEquals(Value.TRUE, run("(< 1 2 3)"));
        assertEquals(Value.FALSE, run("(< 1 3 2)"));
        assertEquals(Value.TRUE, run("(= 2 2 2)"));
        assertEquals(Value.TRUE, run("(>= 3 3 1)"));
        assertEquals(Value.TRUE, run("(<= 1 1 2)"));
        assertEquals(Value.TRUE, run("(> 3 2)"));
        assertEquals(Value.TRUE, run("(not #f)"));
        assertEquals(Value.FALSE, run("(not 0)"));
    }

    @Test
    void arithmeticFailures() {
        assertEquals(EvaluationException.Kind.WRONG_TYPE, failureKind("(+ 1 \"a\")"));
        assertEquals(EvaluationException.Kind.WRONG_TYPE, failureKind("(/ 1 0)"));
        assertEquals(EvaluationException.Kind.ARITY_MISMATCH, failureKind("(-)"));
        assertEquals(EvaluationException.Kind.ARITY_MISMATCH, failureKind("(< 1)"));
    }

    @Test
    void listOperations() {
        assertEquals(Value.number(1), run("(car '(1 2 3))"));
        assertEquals("(2 3)", run("(cdr '(1 2 3))").toString());
        assertEquals("(0 1 2)", run("(cons 0 '(1 2))").toString());
        assertEquals("(1 2)", run("(cons 1 2)").toString());
        assertEquals("(1 (2) \"x\")", run("(list 1 '(2) \"x\")").toString());
        assertEquals(Value.TRUE, run("(null? '())"));
        assertEquals(Value.FALSE, run("(null? '(1))"));
        assertEquals(Value.TRUE, run("(pair? '(1))"));
        assertEquals(Value.number(3), run("(length '(a b c))"));
    }

    @Test
    void listFailures() {
        assertEquals(EvaluationException.Kind.WRONG_TYPE, failureKind("(car '())"));
        assertEquals(EvaluationException.Kind.WRONG_TYPE, failureKind("(cdr 5)"));
        assertEquals(EvaluationException.Kind.ARITY_MISMATCH, failureKind("(car '(1) '(2))"));
    }

    @Test
    void equality() {
        assertEquals(Value.TRUE, run("(eq? 'a 'a)"));
        assertEquals(Value.TRUE, run("(eq? '() '())"));
        assertEquals(Value.FALSE, run("(eq? '(1) '(1))"));
        assertEquals(Value.TRUE, run("(equal? '(1 (2)) '(1 (2)))"));
        assertEquals(Value.TRUE, run("(define l '(1)) (eq? l l)"));
        assertEquals(Value.TRUE, run("(eq? car car)"));
        assertEquals(Value.TRUE, run("(equal? 0 (* -1 0))"));
        assertEquals(Value.TRUE, run("(equal? '(0) (list (- 0)))"));
        assertEquals(Value.number(0).hashCode(), Value.number(-0.0).hashCode());
    }

    @Test
    void displayAndNewlineWriteToEngineOutput() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Scheep es = new Scheep();
        es.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));

        es.run("(display \"x = \") (display 42) (newline) (display '(a \"b\"))");

        assertEquals("x = 42" + System.lineSeparator() + "(a b)", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void hostFunctionsRegisteredAfterStartLandInGlobalFrame() {
        Scheep es = new Scheep();
        es.run("1");
        es.registerFunction("twice", args -> Value.number(2 * args.get(0).asNumber()));
        assertEquals(Value.number(8), es.run("(twice 4)"));
    }
}
