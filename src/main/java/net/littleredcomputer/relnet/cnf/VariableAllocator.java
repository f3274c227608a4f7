package net.littleredcomputer.relnet.cnf;

/**
 * Hands out formula variables as consecutive integers starting at 1. One
 * allocator is threaded through all the encoders contributing to a formula,
 * so every variable has exactly one owner.
 */
public final class VariableAllocator {
    private int last = 0;

    /** @return a fresh variable */
    public int next() {
        return ++last;
    }

    /**
     * Reserves n consecutive fresh variables.
     * @param n number of variables wanted (may be 0)
     * @return the first variable of the block; if n is 0, the variable the next allocation will return
     */
    public int block(int n) {
        if (n < 0) throw new IllegalArgumentException("negative block size " + n);
        int first = last + 1;
        last += n;
        return first;
    }

    /** @return the number of variables allocated so far, which is also the largest one */
    public int count() {
        return last;
    }
}
