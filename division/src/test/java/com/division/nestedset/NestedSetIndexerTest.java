package com.division.nestedset;

import com.division.nestedset.model.Area;
import com.division.nestedset.model.DivisionLevel;
import com.division.nestedset.model.DivisionRecords;
import com.division.nestedset.model.FlatRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static com.division.nestedset.DivisionFixtures.record;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NestedSetIndexerTest {

    private final AreaTreeBuilder builder = new AreaTreeBuilder();

    private final NestedSetIndexer indexer = new NestedSetIndexer();

    @Test
    void singleChainIsNested() {
        List<Area> forest = builder.build(DivisionFixtures.chain());

        assertEquals(8, indexer.index(forest));

        List<Area> nodes = DivisionFixtures.preOrder(forest);
        assertRange(nodes.get(0), "A", 1, 8, 1);
        assertRange(nodes.get(1), "B", 2, 7, 2);
        assertRange(nodes.get(2), "C", 3, 6, 3);
        assertRange(nodes.get(3), "D", 4, 5, 4);
    }

    @Test
    void childlessProvincesGetConsecutiveRanges() {
        List<Area> forest = builder.build(new DivisionRecords(
                List.of(record("11", "北京市", "0"), record("12", "天津市", "0")), null, null, null));

        indexer.index(forest);

        assertRange(forest.get(0), "北京市", 1, 2, 1);
        assertRange(forest.get(1), "天津市", 3, 4, 1);
    }

    @Test
    void counterRunsAcrossWholeForest() {
        List<Area> forest = builder.build(DivisionFixtures.sample());

        assertEquals(22, indexer.index(forest));

        assertRange(forest.get(0), "北京市", 1, 12, 1);
        assertRange(forest.get(1), "河北省", 13, 22, 1);
        Area tangshan = forest.get(1).getChildren().get(1);
        assertRange(tangshan, "唐山市", 20, 21, 2);
    }

    @Test
    void rangesAreContinuousWithoutRepeats() {
        List<Area> forest = builder.build(generated(3, 3, 2, 4));
        indexer.index(forest);

        List<Area> nodes = DivisionFixtures.preOrder(forest);
        TreeSet<Integer> values = new TreeSet<>();
        for (Area node : nodes) {
            assertTrue(values.add(node.getLeft()));
            assertTrue(values.add(node.getRight()));
        }
        assertEquals(2 * nodes.size(), values.size());
        assertEquals(1, values.first());
        assertEquals(2 * nodes.size(), values.last());
    }

    @Test
    void parentRangeContainsEveryDescendant() {
        List<Area> forest = builder.build(generated(2, 3, 3, 2));
        indexer.index(forest);

        for (Area root : forest) {
            assertContainsDescendants(root);
        }
        for (int i = 0; i + 1 < forest.size(); i++) {
            assertTrue(forest.get(i).getRight() < forest.get(i + 1).getLeft());
        }
    }

    @Test
    void depthMatchesLevel() {
        List<Area> forest = builder.build(generated(2, 2, 2, 2));
        indexer.index(forest);

        for (Area node : DivisionFixtures.preOrder(forest)) {
            assertEquals(node.getLevel().getDepth(), node.getDepth());
            if (node.getLevel() == DivisionLevel.STREET) {
                assertEquals(4, node.getDepth());
                assertTrue(node.isLeaf());
            }
        }
        forest.forEach(root -> assertEquals(NestedSetIndexer.ROOT_DEPTH, root.getDepth()));
    }

    @Test
    void rootOffsetsAgreeWithSequentialIndexing() {
        List<Area> forest = builder.build(generated(4, 2, 3, 1));
        int[] offsets = NestedSetIndexer.rootOffsets(forest);

        indexer.index(forest);

        int[] lefts = forest.stream().mapToInt(root -> root.getLeft() - 1).toArray();
        assertArrayEquals(lefts, offsets);
    }

    @Test
    void subtreeCanBeIndexedFromOffset() {
        List<Area> forest = builder.build(DivisionFixtures.sample());
        Area hebei = forest.get(1);

        int last = indexer.index(hebei, NestedSetIndexer.rootOffsets(forest)[1], NestedSetIndexer.ROOT_DEPTH);

        assertEquals(22, last);
        assertEquals(13, hebei.getLeft());
        assertFalse(forest.get(0).isIndexed());
    }

    @Test
    void indexingTwiceIsRejected() {
        List<Area> forest = builder.build(DivisionFixtures.chain());
        indexer.index(forest);

        assertThrows(IllegalStateException.class, () -> indexer.index(forest));
    }

    @Test
    void counterOverflowIsRejected() {
        Area province = builder.build(DivisionFixtures.chain()).get(0);

        assertThrows(IllegalStateException.class, () -> indexer.index(province, Integer.MAX_VALUE - 3, 1));
        assertThrows(IllegalStateException.class, () -> indexer.index(province, -1, 1));
    }

    @Test
    void emptyForestAssignsNothing() {
        assertEquals(0, indexer.index(List.of()));
    }

    private static void assertContainsDescendants(Area node) {
        assertTrue(node.getLeft() < node.getRight());
        List<Area> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Area child = children.get(i);
            assertTrue(node.isAncestorOf(child));
            assertFalse(child.isAncestorOf(node));
            if (i + 1 < children.size()) {
                assertTrue(child.getRight() < children.get(i + 1).getLeft());
            }
            for (Area descendant : DivisionFixtures.preOrder(List.of(child))) {
                assertTrue(node.getLeft() < descendant.getLeft());
                assertTrue(descendant.getRight() < node.getRight());
            }
            assertContainsDescendants(child);
        }
    }

    private static void assertRange(Area node, String name, int left, int right, int depth) {
        assertEquals(name, node.getName());
        assertEquals(left, node.getLeft(), "left of " + name);
        assertEquals(right, node.getRight(), "right of " + name);
        assertEquals(depth, node.getDepth(), "depth of " + name);
    }

    /**
     * 每级按给定数量生成的完整四级数据，省编码从 11 起
     */
    private static DivisionRecords generated(int provinces, int citiesPerProvince, int areasPerCity, int streetsPerArea) {
        List<FlatRecord> p = new ArrayList<>();
        List<FlatRecord> c = new ArrayList<>();
        List<FlatRecord> a = new ArrayList<>();
        List<FlatRecord> s = new ArrayList<>();
        for (int i = 0; i < provinces; i++) {
            String province = String.valueOf(11 + i);
            p.add(record(province, "省" + province, "0"));
            for (int j = 1; j <= citiesPerProvince; j++) {
                String city = province + "%02d".formatted(j);
                c.add(record(city, "市" + city, province));
                for (int k = 1; k <= areasPerCity; k++) {
                    String area = city + "%02d".formatted(k);
                    a.add(record(area, "区" + area, city));
                    for (int m = 1; m <= streetsPerArea; m++) {
                        String street = area + "%03d".formatted(m);
                        s.add(record(street, "街道" + street, area));
                    }
                }
            }
        }
        return new DivisionRecords(p, c, a, s);
    }
}
