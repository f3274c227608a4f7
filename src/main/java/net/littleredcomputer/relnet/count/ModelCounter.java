package net.littleredcomputer.relnet.count;

import net.littleredcomputer.relnet.cnf.Formula;

import java.io.IOException;

/**
 * Counts the assignments to a formula's sampling set under which the rest of
 * the formula is satisfiable.
 */
public interface ModelCounter {
    ModelCount count(Formula formula) throws IOException;
}
