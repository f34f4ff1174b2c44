package org.tapath.analysis;

import lombok.Getter;
import org.tapath.automata.path.Path;
import org.tapath.automata.path.PathSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DP[i][j][k]：从位置 i 到位置 j、恰好 k 条迁移的全部半可实现路径。
 * 每个单元格附带一个签名集合用于去重。表由 {@link SemiRealizablePathFinder} 填充，
 * 填充完成后只读。
 */
public final class SemiRealizablePathTable {

    @Getter
    private final List<String> locationIds;
    @Getter
    private final int maxLength;

    private final Map<String, Map<String, List<Cell>>> cells;
    private final List<Path> undecidedPaths = Collections.synchronizedList(new ArrayList<>());

    SemiRealizablePathTable(List<String> locationIds, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("最大路径长度不能为负数: " + maxLength);
        }
        this.locationIds = List.copyOf(locationIds);
        this.maxLength = maxLength;
        this.cells = new LinkedHashMap<>();
        for (String i : this.locationIds) {
            Map<String, List<Cell>> row = new LinkedHashMap<>();
            for (String j : this.locationIds) {
                List<Cell> byLength = new ArrayList<>(maxLength + 1);
                for (int k = 0; k <= maxLength; k++) {
                    byLength.add(new Cell());
                }
                row.put(j, byLength);
            }
            cells.put(i, row);
        }
    }

    /**
     * @return DP[from][to][length]，按加入顺序；长度超出范围时为空列表。
     * @throws IllegalArgumentException 如果位置不在表中。
     */
    public List<Path> get(String from, String to, int length) {
        if (length < 0 || length > maxLength) {
            return List.of();
        }
        return Collections.unmodifiableList(cell(from, to, length).paths);
    }

    /**
     * @return 从 from 到 to 的全部路径，按长度从短到长。
     */
    public List<Path> paths(String from, String to) {
        List<Path> result = new ArrayList<>();
        for (int k = 0; k <= maxLength; k++) {
            result.addAll(cell(from, to, k).paths);
        }
        return result;
    }

    public boolean contains(String from, String to, int length, Path path) {
        return length >= 0 && length <= maxLength && cell(from, to, length).signatures.contains(path.getSignature());
    }

    /**
     * @return 求解器无法判定（超时等）而未被加入表中的候选路径。
     */
    public List<Path> getUndecidedPaths() {
        synchronized (undecidedPaths) {
            return List.copyOf(undecidedPaths);
        }
    }

    public int totalPaths() {
        int total = 0;
        for (Map<String, List<Cell>> row : cells.values()) {
            for (List<Cell> byLength : row.values()) {
                for (Cell c : byLength) {
                    total += c.paths.size();
                }
            }
        }
        return total;
    }

    /**
     * 调用方保证同一单元格只有一个写者。
     * @return 路径是新加入的则返回 true。
     */
    boolean add(String from, String to, int length, Path path) {
        Cell c = cell(from, to, length);
        if (!c.signatures.add(path.getSignature())) {
            return false;
        }
        c.paths.add(path);
        return true;
    }

    void recordUndecided(Path path) {
        undecidedPaths.add(path);
    }

    private Cell cell(String from, String to, int length) {
        Map<String, List<Cell>> row = cells.get(from);
        if (row == null || !row.containsKey(to)) {
            throw new IllegalArgumentException("位置不在路径表中: " + (row == null ? from : to));
        }
        return row.get(to).get(length);
    }

    @Override
    public String toString() {
        return "SemiRealizablePathTable{locations=" + locationIds.size() + ", maxLength=" + maxLength
                + ", paths=" + totalPaths() + "}";
    }

    private static final class Cell {
        private final List<Path> paths = new ArrayList<>();
        private final Set<PathSignature> signatures = new HashSet<>();
    }
}
