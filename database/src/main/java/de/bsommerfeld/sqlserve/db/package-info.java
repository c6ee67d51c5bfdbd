/**
 * Registry and addressing for the served SQLite files.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [HTTP layer]
 *        │ db segment, table, pk segment
 *        ▼
 *   AddressResolver   ← name / name-hash disambiguation, redirect decision
 *        │
 *        ▼
 *   MetadataRegistry  ← scan, hash, introspect, snapshot (build-metadata.json)
 *        │
 *        ▼
 *   QueryService      ← database / table / row queries, QueryResult
 *        │
 *        ▼
 *   ConnectionCache   ← one immutable ConnectionHandle per name, process lifetime
 * </pre>
 *
 * <h2>Content addressing</h2>
 * Every file is hashed with SHA-256 when the registry is built. URLs carry the
 * first seven hex characters of that digest ({@code /sales-9f86d08/orders});
 * a request with a missing or stale prefix is redirected to the current one.
 * Since a canonical URL can only ever name one file image, responses under it
 * are cacheable forever.
 *
 * <h2>Immutability contract</h2>
 * Files are opened read-only in SQLite's immutable mode. They must not be
 * modified after being placed in the root directory: open handles would keep
 * reading the old image, and a non-forced build trusts the snapshot without
 * re-hashing.
 *
 * <h2>SQL File Inventory</h2>
 * Fixed statements live in {@code sql/*.sql}, loaded via {@link SqlLoader}:
 * <ul>
 * <li>{@code select-user-tables.sql}: user tables from {@code sqlite_master}</li>
 * <li>{@code select-sqlite-master.sql}: default database-level query</li>
 * </ul>
 */
package de.bsommerfeld.sqlserve.db;
