package max.repertoire.service;

public final class RepertoireConfig {

    public final int maxPerOwner;
    public final int maxNameLength;

    private RepertoireConfig(Builder b) {
        maxPerOwner = b.maxPerOwner;
        maxNameLength = b.maxNameLength;
    }

    public static RepertoireConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private int maxPerOwner = Integer.parseInt(System.getProperty("repertoire.maxPerOwner", "50"));
        private int maxNameLength = Integer.parseInt(System.getProperty("repertoire.maxNameLength", "100"));

        public Builder maxPerOwner(int v){maxPerOwner=v;return this;}
        public Builder maxNameLength(int v){maxNameLength=v;return this;}

        public RepertoireConfig build() {
            return new RepertoireConfig(this);
        }
    }
}
