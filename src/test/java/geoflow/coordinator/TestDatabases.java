package geoflow.coordinator;

/**
 * Unique in-memory H2 URLs so test classes never share state.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String uniqueUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }
}
