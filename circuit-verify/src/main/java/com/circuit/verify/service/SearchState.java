package com.circuit.verify.service;

import java.util.HashMap;
import java.util.Map;

/**
 * 回溯搜索的可变状态：已使用的待测元件、标准->待测节点映射及其反向映射。
 * <p>
 * 每次校验新建一个实例，尝试前 {@link #snapshot()}，失败后 {@link #restore(Snapshot)}，
 * 保证每个分支互不污染。
 */
final class SearchState {

    private boolean[] used;
    private int[] pairing;
    private Map<Integer, Integer> mapping = new HashMap<>();
    private Map<Integer, Integer> reverse = new HashMap<>();
    private long steps;

    SearchState(int groundTruthSize, int testSize) {
        this.used = new boolean[testSize];
        this.pairing = new int[groundTruthSize];
    }

    boolean isUsed(int testIndex) {
        return used[testIndex];
    }

    void pair(int groundTruthIndex, int testIndex) {
        used[testIndex] = true;
        pairing[groundTruthIndex] = testIndex;
    }

    /** 标准节点当前绑定的待测节点，未绑定为 null */
    Integer boundTest(int groundTruthNode) {
        return mapping.get(groundTruthNode);
    }

    /** 待测节点当前绑定的标准节点，未绑定为 null */
    Integer boundGroundTruth(int testNode) {
        return reverse.get(testNode);
    }

    /**
     * 绑定 groundTruthNode -> testNode。与已有绑定冲突（任一方向）时返回 false，不做修改。
     */
    boolean bind(int groundTruthNode, int testNode) {
        Integer existing = mapping.get(groundTruthNode);
        if (existing != null) {
            return existing == testNode;
        }
        Integer owner = reverse.get(testNode);
        if (owner != null && owner != groundTruthNode) {
            return false;
        }
        mapping.put(groundTruthNode, testNode);
        reverse.put(testNode, groundTruthNode);
        return true;
    }

    void step() {
        steps++;
    }

    long getSteps() {
        return steps;
    }

    Map<Integer, Integer> getMapping() {
        return mapping;
    }

    int[] getPairing() {
        return pairing;
    }

    int unusedCount() {
        int count = 0;
        for (boolean u : used) {
            if (!u) count++;
        }
        return count;
    }

    Snapshot snapshot() {
        return new Snapshot(used.clone(), pairing.clone(), new HashMap<>(mapping), new HashMap<>(reverse));
    }

    void restore(Snapshot snapshot) {
        this.used = snapshot.used;
        this.pairing = snapshot.pairing;
        this.mapping = snapshot.mapping;
        this.reverse = snapshot.reverse;
    }

    /**
     * 某一时刻的状态副本。恢复后副本归状态所有，同一副本只能恢复一次。
     */
    static final class Snapshot {

        private final boolean[] used;
        private final int[] pairing;
        private final Map<Integer, Integer> mapping;
        private final Map<Integer, Integer> reverse;

        private Snapshot(boolean[] used, int[] pairing,
                         Map<Integer, Integer> mapping, Map<Integer, Integer> reverse) {
            this.used = used;
            this.pairing = pairing;
            this.mapping = mapping;
            this.reverse = reverse;
        }
    }
}
