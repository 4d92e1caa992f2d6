import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.scheep.script.Scheep;
import com.scheep.script.parser.Environment;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Frame;
import com.scheep.script.parser.Value;

public class EnvironmentTraversalTest {

    private static Environment root() {
        return Environment.EMPTY.extend(List.of(), List.of());
    }

    @Test
    void lookupWalksInnermostFirst_andShadows() {
        Environment outer = root();
        outer.define("a", Value.number(1));
        outer.define("shadow", Value.number(10));

        Environment inner = outer.extend(List.of("b", "shadow"), List.of(Value.number(2), Value.number(20)));

        assertEquals(2.0, inner.lookup("b").asNumber());
        assertEquals(1.0, inner.lookup("a").asNumber());
        assertEquals(20.0, inner.lookup("shadow").asNumber());
        assertEquals(10.0, outer.lookup("shadow").asNumber());
    }

    @Test
    void lookupUnbound_throwsUnboundVariable() {
        Environment env = root().extend(List.of("x"), List.of(Value.number(1)));

        EvaluationException ex = assertThrows(EvaluationException.class, () -> env.lookup("missing"));
        assertEquals(EvaluationException.Kind.UNBOUND_VARIABLE, ex.getKind());
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void assignUpdatesNearestExistingBinding_notLocalCopy() {
        Environment outer = root();
        outer.define("i", Value.number(0));
        Environment inner = outer.extend(List.of(), List.of());

        inner.assign("i", Value.number(5));

        assertEquals(5.0, outer.lookup("i").asNumber());
        assertEquals(5.0, inner.lookup("i").asNumber());
        assertFalse(inner.frame.contains("i"), "assign must not create a binding in the inner frame");
    }

    @Test
    void assignUndefined_throwsEvenWhenOtherNamesExist() {
        Environment outer = root();
        outer.define("g", Value.number(1));
        Environment inner = outer.extend(List.of(), List.of());

        EvaluationException ex = assertThrows(EvaluationException.class, () -> inner.assign("missing", Value.number(9)));
        assertEquals(EvaluationException.Kind.UNBOUND_VARIABLE, ex.getKind());
    }

    @Test
    void defineTargetsInnermostFrame_andNeverTouchesOuter() {
        Environment outer = root();
        outer.define("x", Value.number(1));
        Environment inner = outer.extend(List.of(), List.of());

        inner.define("x", Value.number(2));

        assertEquals(2.0, inner.lookup("x").asNumber());
        assertEquals(1.0, outer.lookup("x").asNumber());
    }

    @Test
    void defineOverwritesInPlace() {
        Environment env = root();
        env.define("x", Value.number(1));
        env.define("x", Value.number(2));

        assertEquals(2.0, env.lookup("x").asNumber());
        assertEquals(1, env.frame.size());
    }

    @Test
    void defineIntoEmptyEnvironment_isAnEmbedderError() {
        assertThrows(IllegalStateException.class, () -> Environment.EMPTY.define("x", Value.number(1)));
    }

    @Test
    void extendWithMismatchedLengths_throwsArityMismatch() {
        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> root().extend("f", List.of("a", "b"), List.of(Value.number(1))));
        assertEquals(EvaluationException.Kind.ARITY_MISMATCH, ex.getKind());
        assertTrue(ex.getMessage().contains("f expects 2 arguments, got 1"), ex.getMessage());
    }

    @Test
    void siblingsShareTheParentFrame() {
        Environment parent = root();
        parent.define("counter", Value.number(0));

        Environment first = parent.extend(List.of("n"), List.of(Value.number(1)));
        Environment second = parent.extend(List.of("n"), List.of(Value.number(2)));

        first.assign("counter", Value.number(41));
        assertEquals(41.0, second.lookup("counter").asNumber());
        assertEquals(1.0, first.lookup("n").asNumber());
        assertEquals(2.0, second.lookup("n").asNumber());
    }

    @Test
    void findReturnsTheBindingFrame() {
        Environment outer = root();
        outer.define("a", Value.number(1));
        Environment inner = outer.extend(List.of("b"), List.of(Value.number(2)));

        assertSame(outer.frame, inner.find("a"));
        assertSame(inner.frame, inner.find("b"));
        assertNull(inner.find("c"));
        assertEquals(2, inner.depth());
        assertEquals(List.of(inner.frame, outer.frame), inner.frames());
    }

    @Test
    void globalEnvironmentBindsPrimitivesAndBooleans() {
        Map<String, Scheep.BuiltinFunction> table = Map.of("id", args -> args.get(0));
        Environment global = Environment.makeGlobalEnvironment(table);

        assertEquals(Value.Type.PRIMITIVE, global.lookup("id").getType());
        assertSame(Value.TRUE, global.lookup("true"));
        assertSame(Value.FALSE, global.lookup("false"));
        assertEquals(1, global.depth());
    }

    @Test
    void concurrentDefinesAndReads_seeNoPartialFrames() throws Exception {
        Environment env = root();
        int writers = 4;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                final int id = w;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perWriter; i++) {
                        env.define("v" + id + "_" + i, Value.number(i));
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < perWriter; i++) {
                    Frame f = env.find("v0_" + i);
                    if (f != null) assertNotNull(f.get("v0_" + i));
                }
                return null;
            }));
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers * perWriter, env.frame.size());
        assertEquals(499.0, env.lookup("v3_499").asNumber());
    }
}
