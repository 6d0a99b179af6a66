package io.mcpmemory.core.store.sqlite;

import java.util.List;

final class Schema {

    static final List<String> STATEMENTS = List.of(
        """
            CREATE TABLE IF NOT EXISTS notes (
                id TEXT NOT NULL,
                namespace TEXT NOT NULL,
                project_id TEXT NOT NULL,
                group_id TEXT NOT NULL,
                title TEXT,
                text TEXT NOT NULL,
                tags TEXT,
                source TEXT,
                created_at TEXT,
                metadata TEXT,
                embedding BLOB,
                PRIMARY KEY (namespace, id)
            )
            """,
        "CREATE INDEX IF NOT EXISTS idx_notes_project_id ON notes(namespace, project_id)",
        "CREATE INDEX IF NOT EXISTS idx_notes_group_id ON notes(namespace, project_id, group_id)",
        """
            CREATE TABLE IF NOT EXISTS global_configs (
                id TEXT NOT NULL,
                namespace TEXT NOT NULL,
                project_id TEXT NOT NULL,
                key TEXT NOT NULL,
                value TEXT,
                updated_at TEXT,
                PRIMARY KEY (namespace, id),
                UNIQUE (namespace, project_id, key)
            )
            """,
        """
            CREATE TABLE IF NOT EXISTS note_groups (
                id TEXT NOT NULL,
                namespace TEXT NOT NULL,
                project_id TEXT NOT NULL,
                group_key TEXT NOT NULL,
                title TEXT NOT NULL,
                description TEXT,
                created_at TEXT,
                updated_at TEXT,
                PRIMARY KEY (namespace, id),
                UNIQUE (namespace, project_id, group_key)
            )
            """
    );

    private Schema() {
    }
}
