package net.littleredcomputer.relnet.graph;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class UnionFindTest {
    @Test
    public void unionsAndSizes() {
        UnionFind uf = new UnionFind(6);
        assertThat(uf.union(0, 1), is(true));
        assertThat(uf.union(2, 3), is(true));
        assertThat(uf.union(1, 0), is(false));
        assertThat(uf.connected(0, 2), is(false));
        assertThat(uf.union(3, 1), is(true));
        assertThat(uf.connected(0, 2), is(true));
        assertThat(uf.sizeOf(3), is(4));
        assertThat(uf.sizeOf(5), is(1));
    }
}
