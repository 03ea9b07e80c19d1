package toml;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SerializerTest {

    @Data
    @AllArgsConstructor
    private static class Owner {
        private String name;
        private OffsetDateTime dob;
    }

    @Data
    @AllArgsConstructor
    private static class Database {
        private String server;
        private int[] ports;
        private Boolean enabled;
    }

    @Data
    @AllArgsConstructor
    private static class Config {
        private String title;
        private Owner owner;
        private Database database;
        private List<List<Object>> data;
    }

    private static final TomlSchema<Owner> OWNER = TomlSchema.builder(Owner.class)
            .value("name", Owner::getName)
            .value("dob", Owner::getDob)
            .build();

    private static final TomlSchema<Database> DATABASE = TomlSchema.builder(Database.class)
            .value("server", Database::getServer)
            .array("ports", Database::getPorts)
            .value("enabled", Database::getEnabled)
            .build();

    private static final TomlSchema<Config> CONFIG = TomlSchema.builder(Config.class)
            .value("title", Config::getTitle)
            .group("owner", Config::getOwner, OWNER)
            .group("database", Config::getDatabase, DATABASE)
            .array("data", Config::getData)
            .build();

    @Test
    void writesValuesThenArraysThenGroups() {
        var config = sample();

        var actual = Serializer.toString(config, CONFIG, "");

        assertEquals("title = \"TOML \\\"Example\\\"\"\n"
                + "data = [[\"gamma\", \"delta\"], [1, 2]]\n"
                + "\n"
                + "[owner]\n"
                + "name = \"Tom\\nPreston\"\n"
                + "dob = 1979-05-27T07:32Z\n"
                + "\n"
                + "[database]\n"
                + "server = \"192.168.1.1\"\n"
                + "enabled = true\n"
                + "ports = [8001, 8002]\n", actual);
    }

    @Test
    void writtenDocumentParsesBack() {
        var config = sample();

        var document = Parser.parse(Serializer.toString(config, CONFIG, null));

        assertEquals("TOML \"Example\"", document.getFieldValue("title", String.class));
        assertEquals("Tom\nPreston", document.getFieldValue("owner.name", String.class));
        assertEquals(config.getOwner().getDob(), document.getFieldValue("owner.dob", OffsetDateTime.class));
        assertEquals(List.of(8001L, 8002L), document.getArrayValue("database.ports", Long.class));
        assertEquals(true, document.getFieldValue("database.enabled", Boolean.class));
        assertEquals(ArrayType.OPAQUE, document.getArrayType("data"));
    }

    @Test
    void writesUnderRootKeyGroup() {
        var owner = new Owner("Tom", null);

        assertEquals("[app.owner]\nname = \"Tom\"\n", Serializer.toString(owner, OWNER, "[app.owner]"));
        assertEquals("[app.owner]\nname = \"Tom\"\n", Serializer.toString(owner, OWNER, ".app.owner."));
    }

    @Test
    void skipsNullProperties() {
        var database = new Database(null, null, null);

        assertEquals("", Serializer.toString(database, DATABASE, ""));
    }

    @Test
    void writesToWriter() {
        var writer = new StringWriter();

        Serializer.write(new Owner("Tom", null), OWNER, "", writer);

        assertEquals("name = \"Tom\"\n", writer.toString());
    }

    @Test
    void complexArrayElementsAreRejected() {
        var config = sample();
        config.setData(List.of(List.of(new Owner("Tom", null))));

        var e = assertThrows(UnsupportedOperationException.class, () -> Serializer.toString(config, CONFIG, ""));

        assertEquals("Cannot serialize complex types in an array: " + Owner.class.getName(), e.getMessage());
    }

    @Test
    void nonNativeValuesAreRejected() {
        var schema = TomlSchema.builder(Config.class).value("owner", Config::getOwner).build();

        assertThrows(IllegalArgumentException.class, () -> Serializer.toString(sample(), schema, ""));
        assertThrows(IllegalArgumentException.class, () -> Serializer.toString(null, schema, ""));
    }

    @Test
    void schemaRejectsDuplicateNames() {
        var builder = TomlSchema.builder(Owner.class).value("name", Owner::getName);

        assertThrows(IllegalArgumentException.class, () -> builder.value("name", Owner::getName));
        assertThrows(IllegalArgumentException.class, () -> builder.array("", Owner::getName));
    }

    @Test
    void formatValue() {
        assertEquals("42", Serializer.formatValue(42L));
        assertEquals("1.0", Serializer.formatValue(1.0));
        assertEquals("100000000000000000000.0", Serializer.formatValue(1e20));
        assertEquals("2.50", Serializer.formatValue(new BigDecimal("2.50")));
        assertEquals("\"a\\tb\"", Serializer.formatValue("a\tb"));
        assertEquals("[true, false]", Serializer.formatValue(new boolean[]{true, false}));
        assertEquals("[]", Serializer.formatValue(List.of()));
        assertThrows(IllegalArgumentException.class, () -> Serializer.formatValue(new Object()));
        assertThrows(IllegalArgumentException.class, () -> Serializer.formatValue(Arrays.asList("a", null)));
    }

    private static Config sample() {
        var owner = new Owner("Tom\nPreston", OffsetDateTime.of(1979, 5, 27, 7, 32, 0, 0, ZoneOffset.UTC));
        var database = new Database("192.168.1.1", new int[]{8001, 8002}, true);
        return new Config("TOML \"Example\"", owner, database,
                List.of(List.of("gamma", "delta"), List.of(1, 2)));
    }
}
