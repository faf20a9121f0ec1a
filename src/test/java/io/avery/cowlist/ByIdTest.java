package io.avery.cowlist;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ByIdTest {
    record Item(String id, int value) implements Identified<String> {}

    static CowLinkedList<Item> items() {
        return CowLinkedList.of(
            new Item("id1", 1),
            new Item("id2", 2),
            new Item("id1", 3),
            new Item("id3", 4)
        );
    }

    @Test
    void testAlternatingIds1() {
        Item first1 = new Item("id1", 1);
        Item first2 = new Item("id2", 2);
        Item second1 = new Item("id1", 3);
        Item second2 = new Item("id2", 4);
        CowLinkedList<Item> list = CowLinkedList.of(first1, first2, second1, second2);
        var byId = list.byId(Identified::id);

        assertEquals(List.of(first1, second1), byId.all("id1"));
        assertEquals(first1, byId.removeFirst("id1"));
        assertEquals(3, list.size());
        assertEquals(List.of(first2, second1, second2), list);

        Map<String, Item> indexed = byId.indexed();
        assertEquals(second1, indexed.get("id1"));
        assertEquals(second2, indexed.get("id2"));
    }

    @Test
    void testQueries1() {
        CowLinkedList<Item> list = items();
        var byId = list.byId(Item::id);
        assertEquals(new Item("id1", 1), byId.first("id1"));
        assertNull(byId.first("nope"));
        assertEquals(List.of(new Item("id1", 1), new Item("id1", 3)), byId.all("id1"));
        assertTrue(byId.all("nope").isEmpty());
        assertTrue(byId.contains("id3"));
        assertFalse(byId.contains("nope"));
    }

    @Test
    void testRemoveFirst1() {
        CowLinkedList<Item> list = items();
        assertEquals(new Item("id1", 1), list.byId(Identified::id).removeFirst("id1"));
        assertEquals(List.of(new Item("id2", 2), new Item("id1", 3), new Item("id3", 4)), list);
        assertNull(list.byId(Identified::id).removeFirst("nope"));
        assertEquals(3, list.size());
    }

    @Test
    void testRemoveAll1() {
        CowLinkedList<Item> list = items();
        CowLinkedList<Item> fork = list.fork();
        List<Item> removed = list.byId(Item::id).removeAll("id1");
        assertEquals(List.of(new Item("id1", 1), new Item("id1", 3)), removed);
        assertEquals(List.of(new Item("id2", 2), new Item("id3", 4)), list);
        assertEquals(items(), fork);
    }

    @Test
    void testRemoveAllAtEnds1() {
        CowLinkedList<String> list = CowLinkedList.of("a", "b", "a", "c", "a");
        assertEquals(List.of("a", "a", "a"), list.byId(s -> s).removeAll("a"));
        assertEquals(List.of("b", "c"), list);
        assertEquals("b", list.getFirst());
        assertEquals("c", list.getLast());
    }

    @Test
    void testNoMatchDoesNotCopy1() {
        // Mutating operations that find nothing leave shared elements shared
        CowLinkedList<Item> list = items();
        Position p = list.positionAt(2);
        CowLinkedList<Item> fork = list.fork();
        var byId = fork.byId(Item::id);
        assertNull(byId.removeFirst("nope"));
        assertTrue(byId.removeAll("nope").isEmpty());
        assertFalse(byId.updateFirst("nope", item -> new Item("nope", 0)));
        // Still shared, so positions issued before the fork are still good here
        assertEquals(new Item("id1", 3), fork.get(p));
    }

    @Test
    void testMatchCopies1() {
        CowLinkedList<Item> list = items();
        Position p = list.positionAt(2);
        CowLinkedList<Item> fork = list.fork();
        assertTrue(fork.byId(Item::id).updateFirst("id3", item -> new Item("id3", 40)));
        assertThrows(IllegalArgumentException.class, () -> fork.get(p));
        assertEquals(new Item("id3", 40), fork.getLast());
        assertEquals(new Item("id3", 4), list.getLast());
    }

    @Test
    void testUpdateFirst1() {
        CowLinkedList<Item> list = items();
        assertTrue(list.byId(Item::id).updateFirst("id1", item -> new Item(item.id(), item.value() * 10)));
        assertEquals(List.of(new Item("id1", 10), new Item("id2", 2), new Item("id1", 3), new Item("id3", 4)), list);
    }

    @Test
    void testUpdateFirstThrows1() {
        // A failing transform leaves the list untouched, and its checked exception keeps its type
        CowLinkedList<Item> list = items();
        CowLinkedList<Item> fork = list.fork();
        Position p = list.start();
        Exception e = assertThrows(Exception.class, () ->
            fork.byId(Item::id).updateFirst("id2", item -> { throw new Exception("nope"); }));
        assertEquals("nope", e.getMessage());
        assertEquals(items(), fork);
        assertEquals(new Item("id1", 1), fork.get(p));
    }

    @Test
    void testFiltered1() {
        CowLinkedList<Item> list = items();
        CowLinkedList<Item> filtered = list.byId(Item::id).filtered(Set.of("id1", "id3"));
        assertEquals(List.of(new Item("id1", 1), new Item("id1", 3), new Item("id3", 4)), filtered);
        assertTrue(list.byId(Item::id).filtered(Set.of()).isEmpty());
        assertEquals(items(), list);
    }

    @Test
    void testIndexed1() {
        // Last match wins, in order of first appearance
        Map<String, Item> indexed = items().byId(Item::id).indexed();
        assertEquals(List.of("id1", "id2", "id3"), List.copyOf(indexed.keySet()));
        assertEquals(new Item("id1", 3), indexed.get("id1"));
        assertEquals(new Item("id2", 2), indexed.get("id2"));
    }

    @Test
    void testGrouped1() {
        Map<String, List<Item>> grouped = items().byId(Item::id).grouped();
        assertEquals(List.of("id1", "id2", "id3"), List.copyOf(grouped.keySet()));
        assertEquals(List.of(new Item("id1", 1), new Item("id1", 3)), grouped.get("id1"));
        assertEquals(List.of(new Item("id3", 4)), grouped.get("id3"));
    }

    @Test
    void testNullIds1() {
        CowLinkedList<String> list = CowLinkedList.of("a", null, "b");
        var byId = list.byId(s -> s == null ? null : s.toUpperCase());
        assertTrue(byId.contains(null));
        assertNull(byId.removeFirst(null));
        assertEquals(List.of("a", "b"), list);
    }

    @Test
    void testEmpty1() {
        var byId = new CowLinkedList<Item>().byId(Item::id);
        assertNull(byId.first("id1"));
        assertTrue(byId.indexed().isEmpty());
        assertTrue(byId.grouped().isEmpty());
    }
}
