package com.circuit.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 网表：按顺序排列的元件条目。节点编号只在同一份网表内有意义。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Netlist {

    private List<NetlistEntry> entries = new ArrayList<>();

    public static Netlist of(NetlistEntry... entries) {
        return new Netlist(new ArrayList<>(List.of(entries)));
    }

    public int size() {
        return entries.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public NetlistEntry get(int index) {
        return entries.get(index);
    }
}
