package org.ioautomata.automata.base;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

    @Test
    @DisplayName("同名的输入与输出通道是同一个通道")
    void testEqualityByName() {
        Channel in = Channel.input("name");
        Channel out = Channel.output("name");

        assertAll(
                () -> assertEquals(in, out),
                () -> assertEquals(out, in),
                () -> assertEquals(in.hashCode(), out.hashCode()),
                () -> assertNotEquals(in, Channel.input("other")),
                () -> assertTrue(in.isInput()),
                () -> assertTrue(out.isOutput()),
                () -> assertEquals("name?", in.toString()),
                () -> assertEquals("name!", out.toString())
        );
    }

    @Test
    @DisplayName("分别只含输入与输出的两个集合在同名通道上相交")
    void testSetIntersection() {
        Set<Channel> inputs = new HashSet<>(Set.of(Channel.input("name")));
        inputs.retainAll(Set.of(Channel.output("name")));
        assertEquals(1, inputs.size());
    }

    @Test
    @DisplayName("通道名称不能为空")
    void testEmptyName_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Channel.of("", true));
    }
}
