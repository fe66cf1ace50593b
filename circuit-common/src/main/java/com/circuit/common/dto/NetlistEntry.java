package com.circuit.common.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 网表中的一行：元件标签及其连接的节点编号。
 * <p>
 * 节点顺序即引脚出现顺序，校验器的位置映射依赖这个顺序。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetlistEntry {

    private String label;

    private List<Integer> nodes;

    public static NetlistEntry of(String label, Integer... nodes) {
        return new NetlistEntry(label, List.of(nodes));
    }

    /**
     * 标签中第一个下划线之前的部分，如 R_1 -> R。
     */
    public String typePrefix() {
        if (label == null) {
            return "";
        }
        int idx = label.indexOf('_');
        return idx < 0 ? label : label.substring(0, idx);
    }

    public Set<Integer> nodeSet() {
        return new LinkedHashSet<>(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }
}
