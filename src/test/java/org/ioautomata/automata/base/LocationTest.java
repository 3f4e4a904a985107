package org.ioautomata.automata.base;

import org.ioautomata.expressions.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocationTest {

    private static final Invariant X = Invariant.of(Expression.identifier("x"));
    private static final Invariant Y = Invariant.of(Expression.identifier("y"));

    @Nested
    @DisplayName("相等性 (Equality)")
    class EqualityTests {

        @Test
        @DisplayName("按 (变体, 名称) 比较，忽略不变量")
        void testEqualityByVariantAndName() {
            assertAll(
                    () -> assertEquals(Location.normal("a", X), Location.normal("a", Y)),
                    () -> assertEquals(Location.normal("a").hashCode(), Location.normal("a", Y).hashCode()),
                    () -> assertNotEquals(Location.normal("a"), Location.initial("a")),
                    () -> assertNotEquals(Location.normal("a"), Location.normal("b")),
                    () -> assertNotEquals(Location.inconsistent("a"), Location.universal("a"))
            );
        }

        @Test
        @DisplayName("乘积位置按有序子位置序列比较")
        void testConjunctionEqualityIsOrderSensitive() {
            Location a = Location.normal("a");
            Location b = Location.normal("b");

            assertAll(
                    () -> assertEquals(Location.conjunction(List.of(a, b)), Location.conjunction(List.of(a, b))),
                    () -> assertNotEquals(Location.conjunction(List.of(a, b)), Location.conjunction(List.of(b, a)))
            );
        }
    }

    @Nested
    @DisplayName("吸收代数 (Absorbing algebra)")
    class AlgebraTests {

        @Test
        @DisplayName("任一子位置为 Inconsistent 时乘积为 Inconsistent")
        void testInconsistentAbsorbs() {
            Location product = Location.conjunction(List.of(
                    Location.normal("a", X), Location.inconsistent("bad"), Location.universal("top")));

            assertAll(
                    () -> assertEquals(Location.LocationType.INCONSISTENT, product.getType()),
                    () -> assertEquals("(a && bad && top)", product.getName()),
                    () -> assertEquals(Invariant.FALSE, product.getInvariant()),
                    () -> assertTrue(product.isAbsorbing())
            );
        }

        @Test
        @DisplayName("所有子位置都为 Universal 时乘积为 Universal")
        void testAllUniversal() {
            Location product = Location.conjunction(List.of(Location.universal("p"), Location.universal("q")));

            assertAll(
                    () -> assertEquals(Location.LocationType.UNIVERSAL, product.getType()),
                    () -> assertEquals(Invariant.TRUE, product.getInvariant())
            );
        }

        @Test
        @DisplayName("否则保留非吸收的子位置，不变量为它们的合取")
        void testRetainsNonAbsorbingChildren() {
            Location a = Location.initial("a", X);
            Location b = Location.normal("b", Y);
            Location product = Location.conjunction(List.of(a, Location.universal("top"), b));

            assertAll(
                    () -> assertEquals(Location.LocationType.CONJUNCTION, product.getType()),
                    () -> assertEquals(List.of(a, b), ((Location.Conjunction) product).getLocations()),
                    () -> assertEquals(Invariant.conjunction(X, Y), product.getInvariant()),
                    () -> assertEquals("(a && b)", product.getName()),
                    () -> assertFalse(product.isInitial())
            );
        }

        @Test
        @DisplayName("相同的不变量只出现一次")
        void testDuplicateInvariantsCollapse() {
            Location product = Location.conjunction(List.of(Location.normal("a", X), Location.normal("b", X)));
            assertEquals(X, product.getInvariant());
        }

        @Test
        @DisplayName("乘积位置可以嵌套")
        void testNested() {
            Location inner = Location.conjunction(List.of(Location.normal("a"), Location.normal("b")));
            Location outer = Location.conjunction(List.of(inner, Location.normal("c")));
            assertEquals("((a && b) && c)", outer.getName());
        }

        @Test
        @DisplayName("三种乘积结果使用相同的命名格式")
        void testProductNamingIsUniform() {
            Location a = Location.normal("a", X);
            Location universal = Location.universal("top");
            Location inconsistent = Location.inconsistent("bad");

            assertAll(
                    () -> assertEquals("(a)", Location.conjunction(List.of(a)).getName()),
                    () -> assertEquals("(a)", Location.conjunction(List.of(a, universal)).getName(), "Universal children are dropped"),
                    () -> assertEquals("(top && top)", Location.conjunction(List.of(universal, universal)).getName()),
                    () -> assertEquals("(a && bad)", Location.conjunction(List.of(a, inconsistent)).getName())
            );
        }

        @Test
        @DisplayName("空的子位置列表应抛出异常")
        void testEmpty_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Location.conjunction(List.of()));
        }
    }
}
