/**
 * Persistence layer for the leaderboard job: SQLite-backed in production,
 * in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [AggregationPipeline]
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ daily_yap_scores (source, written upstream)                      │
 * ├──────────────────────┬────────────────────────────────────────────┤
 * │ id  (PK, auto)       │ Insertion order, breaks created_at ties    │
 * │ author_id            │ Author key, one row per reporting period   │
 * │ username             │ Handle at report time                      │
 * │ total_content_score  │ Content score of the period                │
 * │ yaps_all … yaps_l12m │ Eight engagement counters                  │
 * │ tweets               │ JSON array of tweet ids                    │
 * │ created_at           │ Epoch millis, indexed                      │
 * └──────────────────────┴────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ &lt;prefix&gt;_yyyy_MM_dd_HHmm (one table per run)                       │
 * ├──────────────────────┬────────────────────────────────────────────┤
 * │ id  (PK, auto)       │ Insertion order = rank order               │
 * │ author_id (UNIQUE)   │ One row per author                         │
 * │ counters, tweets     │ Aggregated values                          │
 * │ multiplier_factor    │ 1 + yaps_l7d / 100                         │
 * │ composite_score      │ total_content_score × multiplier_factor    │
 * │ mind_share           │ Share of the top-100 composite total       │
 * │ normalized_mind_share│ Share of the top-25 composite total        │
 * │ generated_at         │ Epoch millis of the run                    │
 * │ window_start/_end    │ Epoch millis of the aggregation window     │
 * └──────────────────────┴────────────────────────────────────────────┘
 * </pre>
 *
 * There is no rank column; rank is the row order of {@code id}.
 */
package de.bsommerfeld.mindshare.db;
