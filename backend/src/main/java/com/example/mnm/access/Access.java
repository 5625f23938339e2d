package com.example.mnm.access;

/**
 * Read/write capabilities granted to one tier of callers.
 */
public record Access(boolean read, boolean write) {

    public static final Access NONE = new Access(false, false);
    public static final Access READ = new Access(true, false);
    public static final Access READ_WRITE = new Access(true, true);

    public boolean allows(Operation operation) {
        return switch (operation) {
            case READ -> read;
            case WRITE -> write;
        };
    }

    public Access union(Access other) {
        return new Access(read || other.read, write || other.write);
    }

    /**
     * Unix-style permission digit: read=4, write=2.
     */
    public int digit() {
        return (read ? 4 : 0) + (write ? 2 : 0);
    }
}
