package net.littleredcomputer.relnet.graph;

/**
 * Disjoint sets over the integers [0, n), with union by size and path halving.
 */
public final class UnionFind {
    private final int[] parent;
    private final int[] size;

    public UnionFind(int n) {
        parent = new int[n];
        size = new int[n];
        for (int i = 0; i < n; ++i) {
            parent[i] = i;
            size[i] = 1;
        }
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /** @return true if x and y were in different sets before the call */
    public boolean union(int x, int y) {
        int rx = find(x), ry = find(y);
        if (rx == ry) return false;
        if (size[rx] < size[ry]) {
            int t = rx;
            rx = ry;
            ry = t;
        }
        parent[ry] = rx;
        size[rx] += size[ry];
        return true;
    }

    public boolean connected(int x, int y) {
        return find(x) == find(y);
    }

    /** @return the number of elements in the set containing x */
    public int sizeOf(int x) {
        return size[find(x)];
    }
}
