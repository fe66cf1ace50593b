package com.circuit.common.util;

import com.circuit.common.dto.Netlist;
import com.circuit.common.dto.NetlistEntry;
import com.circuit.common.exception.NetlistFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 网表文本格式：每行一个元件，{@code <label> <nodeID> <nodeID> ...}，空白分隔，无表头。
 */
public final class NetlistFormat {

    private NetlistFormat() {
    }

    /**
     * 解析网表文本。空行跳过，节点编号必须为整数。
     */
    public static Netlist parse(String content) {
        List<NetlistEntry> entries = new ArrayList<>();
        if (content == null) {
            return new Netlist(entries);
        }
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            List<Integer> nodes = new ArrayList<>(parts.length - 1);
            for (int j = 1; j < parts.length; j++) {
                try {
                    nodes.add(Integer.parseInt(parts[j]));
                } catch (NumberFormatException e) {
                    throw new NetlistFormatException(
                            "第 " + (i + 1) + " 行节点编号不是整数: " + parts[j], e);
                }
            }
            entries.add(new NetlistEntry(parts[0], nodes));
        }
        return new Netlist(entries);
    }

    /**
     * 输出网表文本，每个条目一行，以换行结尾。
     */
    public static String format(Netlist netlist) {
        StringBuilder sb = new StringBuilder();
        for (NetlistEntry entry : netlist.getEntries()) {
            sb.append(formatEntry(entry)).append('\n');
        }
        return sb.toString();
    }

    public static String formatEntry(NetlistEntry entry) {
        if (entry.getNodes().isEmpty()) {
            return entry.getLabel();
        }
        return entry.getLabel() + " " + entry.getNodes().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
    }
}
