package bigo.conductor.store;

import org.junit.jupiter.api.Test;

import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    private static final String URL = "jdbc:h2:mem:test-schema;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    @Test
    void schemaIsCreatedAndVersioned() throws Exception {
        try (Database db = new Database(URL, 2)) {
            assertTrue(db.isHealthy());
            assertEquals(Database.SCHEMA_VERSION, db.schemaVersion());

            try (var conn = db.getConnection()) {
                for (String table : new String[] { "tasks", "executions", "validations", "metadata" }) {
                    try (ResultSet rs = conn.getMetaData().getTables(null, null, table, null)) {
                        assertTrue(rs.next(), "missing table " + table);
                    }
                }
            }
        }
    }

    @Test
    void reopeningKeepsASingleVersionRow() throws Exception {
        try (Database first = new Database(URL, 2); Database second = new Database(URL, 2)) {
            assertEquals(Database.SCHEMA_VERSION, second.schemaVersion());
            try (var conn = first.getConnection();
                    var st = conn.createStatement();
                    var rs = st.executeQuery("SELECT COUNT(*) FROM metadata WHERE \"key\" = 'schema_version'")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
            }
        }
    }
}
