package org.axioms.session;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 会话中已断言的结构及已声明的特殊元素。
 * 每个结构在会话生命周期内至多加载一次；会话重置时清空。
 */
public class LoadedStructureSet {

    private final Set<String> structures = new LinkedHashSet<>();
    private final Map<String, SpecialElement> elements = new LinkedHashMap<>();

    public boolean contains(String structureName) {
        return structures.contains(structureName);
    }

    /**
     * 记录结构加载成功。同名特殊元素保留首次声明。
     */
    void markLoaded(String structureName, List<SpecialElement> declared) {
        structures.add(structureName);
        for (SpecialElement element : declared) {
            elements.putIfAbsent(element.getName(), element);
        }
    }

    public Optional<SpecialElement> getSpecialElement(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    public Collection<SpecialElement> specialElements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    /**
     * @return 已加载的结构名，按加载顺序
     */
    public List<String> structures() {
        return List.copyOf(structures);
    }

    public int size() {
        return structures.size();
    }

    void clear() {
        structures.clear();
        elements.clear();
    }

    @Override
    public String toString() {
        return "LoadedStructureSet{structures=" + structures + ", elements=" + elements.keySet() + "}";
    }
}
