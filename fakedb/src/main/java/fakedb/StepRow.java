package fakedb;

/**
 * Raw row of the fake {@code steps} table.
 *
 * <p>Rows are built with {@link #builder()} when seeding a table through
 * {@link FakeStepsConnector#insertTestData(java.util.Collection)}. Unset columns take the
 * fixture defaults below, so a seeded row only names what a test cares about.
 */
public final class StepRow {
    static final int DEFAULT_NUMBER = 29;
    static final String DEFAULT_NAME = "step29";
    static final double DEFAULT_STARTED_AT = 1304262222.0;
    static final String EMPTY_URLS_JSON = "[]";

    Integer id;
    final int buildid;
    int number;
    String name;
    Double startedAt;
    Double locksAcquiredAt;
    Double completeAt;
    String stateString;
    Integer results;
    String urlsJson;
    boolean hidden;

    private StepRow(Integer id, int buildid, int number, String name, Double startedAt, Double locksAcquiredAt,
                    Double completeAt, String stateString, Integer results, String urlsJson, boolean hidden) {
        this.id = id;
        this.buildid = buildid;
        this.number = number;
        this.name = name;
        this.startedAt = startedAt;
        this.locksAcquiredAt = locksAcquiredAt;
        this.completeAt = completeAt;
        this.stateString = stateString;
        this.results = results;
        this.urlsJson = urlsJson;
        this.hidden = hidden;
    }

    static StepRow created(int id, int buildid, int number, String name, String stateString) {
        return new StepRow(id, buildid, number, name, null, null, null, stateString, null, EMPTY_URLS_JSON, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    StepRow copy() {
        return new StepRow(id, buildid, number, name, startedAt, locksAcquiredAt,
                completeAt, stateString, results, urlsJson, hidden);
    }

    public Integer id() {
        return id;
    }

    public int buildid() {
        return buildid;
    }

    public int number() {
        return number;
    }

    public String name() {
        return name;
    }

    public Double startedAt() {
        return startedAt;
    }

    public Double locksAcquiredAt() {
        return locksAcquiredAt;
    }

    public Double completeAt() {
        return completeAt;
    }

    public String stateString() {
        return stateString;
    }

    public Integer results() {
        return results;
    }

    public String urlsJson() {
        return urlsJson;
    }

    public boolean hidden() {
        return hidden;
    }

    @Override
    public String toString() {
        return "StepRow[id=" + id + ", buildid=" + buildid + ", number=" + number + ", name=" + name + "]";
    }

    public static final class Builder {
        private Integer id;
        private Integer buildid;
        private int number = DEFAULT_NUMBER;
        private String name = DEFAULT_NAME;
        private Double startedAt = DEFAULT_STARTED_AT;
        private Double locksAcquiredAt;
        private Double completeAt;
        private String stateString = "";
        private Integer results;
        private String urlsJson = EMPTY_URLS_JSON;
        private boolean hidden;

        private Builder() {
        }

        public Builder id(Integer id) {
            this.id = id;
            return this;
        }

        public Builder buildid(int buildid) {
            this.buildid = buildid;
            return this;
        }

        public Builder number(int number) {
            this.number = number;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder startedAt(Double startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder locksAcquiredAt(Double locksAcquiredAt) {
            this.locksAcquiredAt = locksAcquiredAt;
            return this;
        }

        public Builder completeAt(Double completeAt) {
            this.completeAt = completeAt;
            return this;
        }

        public Builder stateString(String stateString) {
            this.stateString = stateString;
            return this;
        }

        public Builder results(Integer results) {
            this.results = results;
            return this;
        }

        public Builder urlsJson(String urlsJson) {
            this.urlsJson = urlsJson;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public StepRow build() {
            if (buildid == null) {
                throw new IllegalStateException("Step row requires a buildid");
            }
            return new StepRow(id, buildid, number, name, startedAt, locksAcquiredAt,
                    completeAt, stateString, results, urlsJson, hidden);
        }
    }
}
