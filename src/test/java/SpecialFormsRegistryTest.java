import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.scheep.script.Scheep;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Evaluator;
import com.scheep.script.parser.SpecialForms;
import com.scheep.script.parser.Value;

public class SpecialFormsRegistryTest {

    @Test
    void coreFormsAreRegistered() {
        Scheep es = new Scheep();
        for (String tag : List.of("quote", "set!", "define", "if", "lambda", "begin", "define-syntax")) {
            assertTrue(es.evaluator().forms().has(tag), "missing special form " + tag);
        }
        assertFalse(es.evaluator().forms().has("cond"), "cond is rewritten, not dispatched");
    }

    @Test
    void hostRegisteredForm_receivesRawExpression() {
        Scheep es = new Scheep();
        // (unless-zero n expr): evaluates expr only when n is not 0
        es.registerSpecialForm("unless-zero", (expr, env, ev) -> {
            List<Value> form = expr.asList();
            if (form.size() != 3) throw EvaluationException.malformedSyntax("(unless-zero n expr)");
            double n = ev.evaluate(form.get(1), env).asNumber();
            return (n == 0) ? Value.FALSE : ev.evaluate(form.get(2), env);
        });

        assertEquals(Value.FALSE, es.run("(unless-zero 0 (car '()))"));
        assertEquals(Value.number(3), es.run("(unless-zero 1 (+ 1 2))"));
    }

    @Test
    void registrationAfterStart_isRejected() {
        Scheep es = new Scheep();
        es.run("1");
        assertThrows(IllegalStateException.class,
                () -> es.registerSpecialForm("late", (expr, env, ev) -> Value.TRUE));
    }

    @Test
    void evaluatorSealsTheRegistry() {
        SpecialForms forms = new SpecialForms();
        forms.register("nop", (expr, env, ev) -> Value.TRUE);
        assertFalse(forms.isSealed());

        new Evaluator(forms);

        assertTrue(forms.isSealed());
        assertTrue(forms.has("nop"));
        assertThrows(IllegalStateException.class, () -> forms.register("other", (expr, env, ev) -> Value.TRUE));
        assertThrows(UnsupportedOperationException.class, () -> forms.tags().clear());
    }

    @Test
    void invalidRegistrations_areRejected() {
        SpecialForms forms = new SpecialForms();
        assertThrows(IllegalArgumentException.class, () -> forms.register("", (expr, env, ev) -> Value.TRUE));
        assertThrows(IllegalArgumentException.class, () -> forms.register("x", null));
    }
}
