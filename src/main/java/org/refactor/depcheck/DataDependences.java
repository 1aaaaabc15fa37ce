package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一个过程的访存依赖结果。局部依赖和非局部依赖分开存放，合在一起才是完整的信息。
 */
public final class DataDependences<I, A> {

    private final ImmutableMap<I, MemoryDependence.Local<I, A>> local;
    private final ImmutableMap<I, ImmutableList<MemoryDependence.NonLocalEntry<I, A>>> nonLocal;
    private final ImmutableList<Diagnostic> diagnostics;

    DataDependences(ImmutableMap<I, MemoryDependence.Local<I, A>> local,
                    ImmutableMap<I, ImmutableList<MemoryDependence.NonLocalEntry<I, A>>> nonLocal,
                    ImmutableList<Diagnostic> diagnostics) {
        this.local = local;
        this.nonLocal = nonLocal;
        this.diagnostics = diagnostics;
    }

    public Map<I, MemoryDependence.Local<I, A>> localDependences() {
        return local;
    }

    public Map<I, ImmutableList<MemoryDependence.NonLocalEntry<I, A>>> nonLocalDependences() {
        return nonLocal;
    }

    public Optional<MemoryDependence.Local<I, A>> local(I instruction) {
        return Optional.ofNullable(local.get(instruction));
    }

    public List<MemoryDependence.NonLocalEntry<I, A>> nonLocal(I instruction) {
        return nonLocal.getOrDefault(instruction, ImmutableList.of());
    }

    /**
     * @return 指令记录下来的依赖类型；没有记录（不访存或查询失败）时为 empty
     */
    public Optional<DependenceKind> kindOf(I instruction) {
        if (local.containsKey(instruction)) {
            return Optional.of(local.get(instruction).kind());
        }
        if (nonLocal.containsKey(instruction)) {
            return Optional.of(DependenceKind.NON_LOCAL);
        }
        return Optional.empty();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
