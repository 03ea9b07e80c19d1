package toml;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GroupTest {

    @Test
    void createGroupIsIdempotent() {
        var document = Document.create();

        var first = document.createGroup("servers.alpha");
        var second = document.createGroup("servers.alpha");

        assertSame(first, second);
        assertEquals("servers.alpha", first.getFullKey());
        assertEquals("alpha", first.getKey());
        assertSame(document.getGroup("servers"), first.getParent());
    }

    @Test
    void createGroupRejectsEmptyParts() {
        var document = Document.create();

        assertThrows(IllegalArgumentException.class, () -> document.createGroup("a..b"));
        assertThrows(IllegalArgumentException.class, () -> document.createGroup(".a"));
    }

    @Test
    void groupLookups() {
        var document = Document.create();
        document.createGroup("a.b");

        assertTrue(document.tryGetGroup("a.b").isPresent());
        assertFalse(document.tryGetGroup("a.c").isPresent());
        assertFalse(document.groupExists("b"));
        var e = assertThrows(KeyNotFoundException.class, () -> document.getGroup("a.c"));
        assertEquals("a.c", e.getPath());
    }

    @Test
    void groupChains() {
        var document = Document.create();
        var c = document.createGroup("a.b.c");

        assertEquals(List.of("c", "b", "a", ""), keys(c.getDescendingGroups()));
        assertEquals(List.of("", "a", "b", "c"), keys(c.getAscendingGroups()));
    }

    @Test
    void addValueCreatesIntermediateGroups() {
        var document = Document.create();
        document.addValue(new Entry("x.y", "z", "1", 1, 4, TomlType.INT));

        assertTrue(document.groupExists("x.y"));
        assertEquals("1", document.getValueString("x.y.z"));
        assertEquals(1, document.getGroup("x.y").getItems().size());
    }

    @Test
    void addValueIsRelativeToGroup() {
        var document = Document.create();
        var server = document.createGroup("server");

        server.addValue(new Entry("server.http", "port", "8080", 1, 0, TomlType.INT));

        assertEquals("8080", server.getValueString("http.port"));
        assertEquals("8080", document.getValueString("server.http.port"));
        assertThrows(IllegalArgumentException.class,
                () -> server.addValue(new Entry("client", "port", "1", 1, 0, TomlType.INT)));
    }

    @Test
    void addValueFromObject() {
        var document = Document.create();
        var group = document.createGroup("owner");

        group.addValue("name", "Tom \"T\"");
        group.addValue("age", 42);
        group.addValue("ratio", 0.5);
        group.addValue("tags", List.of("a", "b"));

        assertEquals("Tom \"T\"", document.getValueString("owner.name"));
        assertEquals(TomlType.INT, document.getValue("owner.age").getParsedType());
        assertEquals(TomlType.FLOAT, document.getValue("owner.ratio").getParsedType());
        assertEquals("[a,b]", document.getValueString("owner.tags"));
        assertThrows(IllegalArgumentException.class, () -> group.addValue("", 1));
        assertThrows(IllegalArgumentException.class, () -> group.addValue("missing", null));
    }

    @Test
    void duplicatesAreRejected() {
        var document = Parser.parse("[a]\nb = 1\n[a.c]\n");

        var sameValue = assertThrows(DuplicateKeyException.class, () -> document.addValue("a.b", 2));
        assertEquals("a.b", sameValue.getKey());
        assertThrows(DuplicateKeyException.class, () -> document.getGroup("a").addValue("c", 2));
        assertThrows(DuplicateKeyException.class, () -> document.createGroup("a.b.d"));
        assertEquals("1", document.getValueString("a.b"));
    }

    @Test
    void allItemsAreDepthFirst() {
        var document = Parser.parse("root = 1\n[b]\nb1 = 1\n[a]\na1 = 1\n[b.x]\nbx = 1\n[b]\nb2 = 2\n");

        var names = document.getAllItems().stream().map(Entry::getFullName).collect(Collectors.toList());

        assertEquals(List.of("root", "b.b1", "b.b2", "b.x.bx", "a.a1"), names);
    }

    @Test
    void toStringRendersGroupsAndValues() {
        var document = Parser.parse("title = \"x\"\n[db]\nports = [1, 2]\n[db.main]\nenabled = true\n");

        assertEquals("title = \"x\"\n\n[db]\nports = [1, 2]\n\n[db.main]\nenabled = true\n", document.toString());
    }

    private static List<String> keys(List<Group> groups) {
        return groups.stream().map(Group::getKey).collect(Collectors.toList());
    }
}
