import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.scheep.script.parser.ParseException;
import com.scheep.script.parser.Parser;
import com.scheep.script.parser.Value;

public class SchemeReaderTest {

    @Test
    void atoms() {
        assertEquals(Value.number(42), Parser.readOne("42"));
        assertEquals(Value.number(-3.5), Parser.readOne("-3.5"));
        assertEquals(Value.number(7), Parser.readOne("+7"));
        assertEquals(Value.symbol("-"), Parser.readOne("-"));
        assertEquals(Value.symbol("..."), Parser.readOne("..."));
        assertEquals(Value.symbol("set!"), Parser.readOne("set!"));
        assertEquals(Value.symbol("1+"), Parser.readOne("1+"));
        assertEquals(Value.string("hi"), Parser.readOne("\"hi\""));
    }

    @Test
    void booleans() {
        assertSame(Value.TRUE, Parser.readOne("#t"));
        assertSame(Value.FALSE, Parser.readOne("#f"));
        assertSame(Value.TRUE, Parser.readOne("true"));
        assertSame(Value.FALSE, Parser.readOne("false"));
        assertSame(Value.TRUE, Parser.readOne("#true"));
    }

    @Test
    void stringEscapes() {
        assertEquals("a\"b\\c\nd\te", Parser.readOne("\"a\\\"b\\\\c\\nd\\te\"").asString());
    }

    @Test
    void nestedListsAndQuote() {
        Value v = Parser.readOne("(define (f x) '(x (y)))");
        assertEquals("(define (f x) '(x (y)))", v.toString());

        List<Value> quoted = Parser.readOne("'a").asList();
        assertEquals(Value.symbol("quote"), quoted.get(0));
        assertEquals(Value.symbol("a"), quoted.get(1));
    }

    @Test
    void commentsAndWhitespaceAreSkipped() {
        List<Value> forms = Parser.read("; header\n(a b) ; trailing\n\n  c\t");
        assertEquals(2, forms.size());
        assertEquals("(a b)", forms.get(0).toString());
        assertEquals(Value.symbol("c"), forms.get(1));
    }

    @Test
    void emptyList() {
        assertTrue(Parser.readOne("()").isEmptyList());
    }

    @Test
    void unbalancedInput_reportsLine() {
        ParseException open = assertThrows(ParseException.class, () -> Parser.read("\n\n(a (b c)"));
        assertEquals(3, open.getLine());

        assertThrows(ParseException.class, () -> Parser.read("a)"));
        assertThrows(ParseException.class, () -> Parser.read("\"never closed"));
        assertThrows(ParseException.class, () -> Parser.read("'"));
        assertThrows(ParseException.class, () -> Parser.read("#x"));
    }

    @Test
    void readOneRejectsSeveralForms() {
        assertThrows(ParseException.class, () -> Parser.readOne("a b"));
    }

    @Test
    void printerRoundTripsTypicalPrograms() {
        String src = "(define (len xs) (if (null? xs) 0 (+ 1 (len (cdr xs)))))";
        assertEquals(src, Parser.readOne(src).toString());
        assertEquals("2.5", Parser.readOne("2.5").toString());
        assertEquals("\"a\\\"b\"", Parser.readOne("\"a\\\"b\"").toString());
    }
}
