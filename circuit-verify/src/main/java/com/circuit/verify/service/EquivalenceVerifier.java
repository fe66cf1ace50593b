package com.circuit.verify.service;

import com.circuit.common.dto.Netlist;
import com.circuit.common.dto.NetlistEntry;
import com.circuit.verify.config.VerifierProperties;
import com.circuit.verify.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * 网表等价校验：两份网表节点编号各自独立，判断是否存在一个节点重命名，
 * 使每个标准元件都能配对到一个不同的待测元件，且节点一一对应。
 * <p>
 * 按标准网表顺序逐个元件回溯：
 * <ol>
 *   <li>集合匹配：待测元件的节点集合与标准元件完全相同（编号体系本来就一致的快速通道）</li>
 *   <li>位置映射：节点数相同的待测元件，第 i 个标准节点映射到第 i 个待测节点，
 *       与之前已锁定的映射冲突则放弃该候选</li>
 * </ol>
 * 所有标准元件都配对成功即返回 true，第一个解即为结果；搜索穷尽返回 false。
 * 搜索状态在每次调用内新建，本服务无共享可变状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EquivalenceVerifier {

    private final VerifierProperties properties;

    /**
     * 两份网表是否拓扑等价。
     */
    public boolean verify(Netlist groundTruth, Netlist test) {
        return match(groundTruth, test).isEquivalent();
    }

    /**
     * 执行校验并在成功时返回节点映射与元件配对。
     */
    public MatchResult match(Netlist groundTruth, Netlist test) {
        SearchState state = new SearchState(groundTruth.size(), test.size());
        trace("开始网表比对: 标准 {} 个元件, 待测 {} 个元件", groundTruth.size(), test.size());

        if (!backtrack(0, groundTruth, test, state)) {
            log.debug("网表不等价, 搜索步数 {}", state.getSteps());
            return MatchResult.builder()
                    .equivalent(false)
                    .nodeMapping(new TreeMap<>())
                    .pairing(List.of())
                    .steps(state.getSteps())
                    .build();
        }

        // 成功时状态停在解上，此时捕获映射
        List<Integer> pairing = new ArrayList<>(groundTruth.size());
        for (int testIndex : state.getPairing()) {
            pairing.add(testIndex);
        }
        log.debug("网表等价, 搜索步数 {}", state.getSteps());
        return MatchResult.builder()
                .equivalent(true)
                .nodeMapping(new TreeMap<>(state.getMapping()))
                .pairing(pairing)
                .steps(state.getSteps())
                .unpairedTestComponents(state.unusedCount())
                .build();
    }

    private boolean backtrack(int index, Netlist groundTruth, Netlist test, SearchState state) {
        if (index >= groundTruth.size()) {
            return true;
        }
        NetlistEntry expected = groundTruth.get(index);
        trace("处理标准元件 #{}: {}", index, expected);

        // ==================== 第一步：集合匹配 ====================
        Set<Integer> expectedNodes = expected.nodeSet();
        for (int t = 0; t < test.size(); t++) {
            if (state.isUsed(t)) continue;
            NetlistEntry candidate = test.get(t);
            state.step();
            if (!typesCompatible(expected, candidate) || !expectedNodes.equals(candidate.nodeSet())) {
                continue;
            }

            SearchState.Snapshot snapshot = state.snapshot();
            if (bindIdentity(expected, state)) {
                trace("集合匹配: {} == {}", expected, candidate);
                state.pair(index, t);
                if (backtrack(index + 1, groundTruth, test, state)) {
                    return true;
                }
                trace("集合匹配回溯: {} / {}", expected, candidate);
            } else {
                trace("集合匹配与已锁定节点冲突: {} / {}", expected, candidate);
            }
            state.restore(snapshot);
        }

        // ==================== 第二步：位置映射 ====================
        for (int t = 0; t < test.size(); t++) {
            if (state.isUsed(t)) continue;
            NetlistEntry candidate = test.get(t);
            state.step();
            if (!typesCompatible(expected, candidate)) {
                continue;
            }
            if (candidate.nodeCount() != expected.nodeCount()) {
                trace("节点数不一致, 跳过: {} / {}", expected, candidate);
                continue;
            }

            SearchState.Snapshot snapshot = state.snapshot();
            if (bindPositional(expected, candidate, state)) {
                trace("位置映射成功: {} -> {}", expected, candidate);
                state.pair(index, t);
                if (backtrack(index + 1, groundTruth, test, state)) {
                    return true;
                }
                trace("位置映射回溯: {} / {}", expected, candidate);
            }
            state.restore(snapshot);
        }

        return false;
    }

    /**
     * 集合匹配时每个标准节点映射到同编号的待测节点。
     * 未开启锁定时不写入映射，也就不受已有映射约束。
     */
    private boolean bindIdentity(NetlistEntry expected, SearchState state) {
        if (!properties.isLockSetMatchNodes()) {
            return true;
        }
        for (Integer node : expected.getNodes()) {
            if (!state.bind(node, node)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 第 i 个标准节点绑定第 i 个待测节点；任一位置与已锁定映射冲突即失败。
     */
    private boolean bindPositional(NetlistEntry expected, NetlistEntry candidate, SearchState state) {
        List<Integer> expectedNodes = expected.getNodes();
        List<Integer> candidateNodes = candidate.getNodes();
        for (int i = 0; i < expectedNodes.size(); i++) {
            int groundTruthNode = expectedNodes.get(i);
            int testNode = candidateNodes.get(i);
            if (!state.bind(groundTruthNode, testNode)) {
                trace("锁定节点冲突: {} -> {} (已绑定 {}), 待测节点 {} 已属于 {}",
                        groundTruthNode, testNode, state.boundTest(groundTruthNode),
                        testNode, state.boundGroundTruth(testNode));
                return false;
            }
        }
        return true;
    }

    private boolean typesCompatible(NetlistEntry expected, NetlistEntry candidate) {
        return !properties.isMatchComponentTypes()
                || expected.typePrefix().equalsIgnoreCase(candidate.typePrefix());
    }

    private void trace(String format, Object... args) {
        if (properties.isTraceEnabled() && log.isDebugEnabled()) {
            log.debug(format, args);
        }
    }
}
