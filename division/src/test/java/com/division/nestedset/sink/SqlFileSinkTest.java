package com.division.nestedset.sink;

import com.division.mybatisplus.entity.NestedArea;
import com.division.mybatisplus.utils.TableMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlFileSinkTest {

    private static final TableMetadata METADATA = TableMetadata.of(NestedArea.class, NestedArea.INSERT_FIELDS);

    @TempDir
    Path tempDir;

    @Test
    void writesOneStatementPerRow() throws IOException {
        Path target = tempDir.resolve("out/division.sql");

        try (SqlFileSink sink = SqlFileSink.open(target, METADATA)) {
            sink.write(new NestedArea("11", "北京市", "0", 1, 1, 4));
            sink.write(new NestedArea("1101", "市辖区", "11", 2, 2, 3));
            sink.finish();
        }

        assertEquals(List.of(
                "INSERT INTO nested(id, node, pid, depth, lft, rgt) VALUES(11, '北京市', 0, 1, 1, 4);",
                "INSERT INTO nested(id, node, pid, depth, lft, rgt) VALUES(1101, '市辖区', 11, 2, 2, 3);"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("out/division.sql.tmp")));
    }

    @Test
    void quotesInNamesAreDoubled() {
        String statement = SqlFileSink.toStatement(METADATA.withTableName("area").insertPrefix(),
                new NestedArea("11", "O'Hare", "0", 1, 1, 2));

        assertEquals("INSERT INTO area(id, node, pid, depth, lft, rgt) VALUES(11, 'O''Hare', 0, 1, 1, 2);", statement);
    }

    @Test
    void unfinishedOutputLeavesNoFile() throws IOException {
        Path target = tempDir.resolve("division.sql");
        Files.writeString(target, "previous");

        try (SqlFileSink sink = SqlFileSink.open(target, METADATA)) {
            sink.write(new NestedArea("11", "北京市", "0", 1, 1, 2));
        }

        assertEquals("previous", Files.readString(target));
        assertFalse(Files.exists(tempDir.resolve("division.sql.tmp")));
    }

    @Test
    void finishReplacesExistingFile() throws IOException {
        Path target = tempDir.resolve("division.sql");
        Files.writeString(target, "previous");

        try (SqlFileSink sink = SqlFileSink.open(target, METADATA)) {
            sink.finish();
        }

        assertTrue(Files.exists(target));
        assertEquals(0, Files.size(target));
    }
}
