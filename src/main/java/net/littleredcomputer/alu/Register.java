package net.littleredcomputer.alu;

/**
 * The four registers of the ALU. Register files are arrays of length {@link #SIZE}
 * indexed by {@link #ordinal()}.
 */
public enum Register {
    W, X, Y, Z;

    public static final int SIZE = values().length;

    /**
     * @param name register name as it appears in program text ("w", "x", "y" or "z")
     * @return the corresponding register
     */
    public static Register parse(String name) {
        switch (name) {
            case "w": return W;
            case "x": return X;
            case "y": return Y;
            case "z": return Z;
            default: throw new IllegalArgumentException("unknown register: " + name);
        }
    }
}
