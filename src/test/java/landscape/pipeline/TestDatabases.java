package landscape.pipeline;

/**
 * In-memory H2 URLs, unique per call so test classes never share data.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String memUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }
}
