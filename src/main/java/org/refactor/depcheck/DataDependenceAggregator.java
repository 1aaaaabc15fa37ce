package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 逐条询问访存依赖查询，并把结果分成局部、非局部两类保存。本身不做任何分析。
 */
public class DataDependenceAggregator {

    private static final Logger LOG = Logger.getLogger(DataDependenceAggregator.class.getName());

    /**
     * @param instructions   过程中的所有指令
     * @param accessesMemory 指令是否读写内存，不访存的指令直接跳过
     * @param oracle         访存依赖查询
     */
    public static <I, A> DataDependences<I, A> aggregate(Iterable<I> instructions,
                                                         Predicate<? super I> accessesMemory,
                                                         MemoryDependenceOracle<I, A> oracle) {
        Map<I, MemoryDependence.Local<I, A>> local = new LinkedHashMap<>();
        Map<I, ImmutableList<MemoryDependence.NonLocalEntry<I, A>>> nonLocal = new LinkedHashMap<>();
        ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();

        for (I inst : instructions) {
            if (!accessesMemory.test(inst)) {
                continue;
            }

            MemoryDependence<I, A> dep;
            try {
                dep = oracle.query(inst);
            } catch (UnsupportedAccessException e) {
                // 这条指令的依赖不记录，其余指令照常处理
                LOG.log(Level.WARNING, "{0}: {1}", new Object[]{inst, e.getMessage()});
                diagnostics.add(Diagnostic.unsupportedAccess(inst, e.getMessage()));
                continue;
            }

            if (dep instanceof MemoryDependence.Local<I, A> l) {
                local.put(inst, l);
            } else if (dep instanceof MemoryDependence.NonLocal<I, A> nl) {
                List<MemoryDependence.NonLocalEntry<I, A>> entries = nl.entries();
                LOG.log(Level.FINE, "{0} has {1} non-local dependence(s)", new Object[]{inst, entries.size()});
                nonLocal.put(inst, ImmutableList.copyOf(entries));
            } else {
                throw new IllegalStateException("Unknown dependence result " + dep);
            }
        }

        return new DataDependences<>(ImmutableMap.copyOf(local), ImmutableMap.copyOf(nonLocal), diagnostics.build());
    }
}
