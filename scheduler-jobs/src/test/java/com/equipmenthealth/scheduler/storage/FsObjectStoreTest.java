package com.equipmenthealth.scheduler.storage;

import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.model.ObjectRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FsObjectStoreTest {

    @TempDir
    Path root;

    @Test
    void readsObjectsUnderBucketDirectories() throws Exception {
        Path file = root.resolve("out/pump/results.jsonl");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}\n");
        FsObjectStore store = new FsObjectStore(root);

        try (InputStream in = store.getObject(new ObjectRef("out", "pump/results.jsonl"))) {
            assertEquals("{}\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void missingObjectIsTransportFailureWithKey() {
        FsObjectStore store = new FsObjectStore(root);

        TransportFailureException ex = assertThrows(TransportFailureException.class,
                () -> store.getObject(new ObjectRef("out", "missing.jsonl")));
        assertEquals("GetObject", ex.operation());
        assertEquals("missing.jsonl", ex.context().objectKey());
    }

    @Test
    void keysCannotEscapeTheRoot() {
        FsObjectStore store = new FsObjectStore(root);

        TransportFailureException ex = assertThrows(TransportFailureException.class,
                () -> store.getObject(new ObjectRef("out", "../../etc/passwd")));
        assertEquals("../../etc/passwd", ex.context().objectKey());
        assertTrue(ex.getMessage().contains("escapes the store root"));
    }
}
