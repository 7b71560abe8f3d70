package com.duckora.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tag annotations for selecting test subsets, e.g. {@code -Dgroups=unit}.
 */
public final class TestCategories {

    private TestCategories() {
    }

    /** Fast tests with no remote database. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {
    }

    /** Tests running against the emulated remote database. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("integration")
    public @interface Integration {
    }

    /** Core behavior that must pass on every build. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier1")
    public @interface Tier1 {
    }

    /** Secondary behavior and edge cases. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier2")
    public @interface Tier2 {
    }

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("type-mapping")
    public @interface TypeMapping {
    }

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("pushdown")
    public @interface Pushdown {
    }
}
