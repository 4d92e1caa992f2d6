import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.scheep.script.parser.CondRewriter;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Parser;
import com.scheep.script.parser.Value;

public class CondRewriterTest {

    private static String rewrite(String src) {
        return CondRewriter.rewrite(Parser.readOne(src)).toString();
    }

    @Test
    void clausesBecomeNestedIfs() {
        assertEquals("(if a 1 (if b 2 #f))", rewrite("(cond (a 1) (b 2))"));
    }

    @Test
    void elseClauseBecomesTheFinalAlternative() {
        assertEquals("(if a 1 2)", rewrite("(cond (a 1) (else 2))"));
        assertEquals("3", rewrite("(cond (else 3))"));
    }

    @Test
    void actionsCollapseByCount() {
        assertEquals("(if a () #f)", rewrite("(cond (a))"));
        assertEquals("(if a x #f)", rewrite("(cond (a x))"));
        assertEquals("(if a (begin x y) #f)", rewrite("(cond (a x y))"));
    }

    @Test
    void noClauses_rewritesToFalse() {
        assertEquals(Value.FALSE, CondRewriter.rewrite(Parser.readOne("(cond)")));
    }

    @Test
    void nonFinalElse_isMalformed() {
        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> rewrite("(cond (a 1) (else 2) (b 3))"));
        assertEquals(EvaluationException.Kind.MALFORMED_SYNTAX, ex.getKind());
        assertTrue(ex.getMessage().contains("else"));
    }

    @Test
    void emptyClause_isMalformed() {
        EvaluationException ex = assertThrows(EvaluationException.class, () -> rewrite("(cond ())"));
        assertEquals(EvaluationException.Kind.MALFORMED_SYNTAX, ex.getKind());
    }

    @Test
    void isCondRecognisesOnlyCondForms() {
        assertTrue(CondRewriter.isCond(Parser.readOne("(cond (a 1))")));
        assertFalse(CondRewriter.isCond(Parser.readOne("(if a 1 2)")));
        assertFalse(CondRewriter.isCond(Parser.readOne("cond")));
    }
}
