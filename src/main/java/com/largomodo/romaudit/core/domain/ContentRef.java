package com.largomodo.romaudit.core.domain;

/**
 * A (machine, logical name) pair declaring some content in the catalog.
 */
public record ContentRef(String machine, String name) implements Comparable<ContentRef> {

    @Override
    public int compareTo(ContentRef o) {
        int byMachine = machine.compareTo(o.machine);
        return byMachine != 0 ? byMachine : name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return machine + ":" + name;
    }
}
