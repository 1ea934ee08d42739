module io.github.cyfko.fuzzycast.jpa {
    requires io.github.cyfko.fuzzycast.core;
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.fuzzycast.jpa;
    exports io.github.cyfko.fuzzycast.jpa.spi;
    exports io.github.cyfko.fuzzycast.jpa.utils;
}
