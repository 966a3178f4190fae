package io.phosflow.storage;

import io.phosflow.model.PipelineStep;
import io.phosflow.model.StageRecord;
import io.phosflow.model.StageState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed per-step state of every unit plus an append-only transition history.
 */
public final class StageStateStore {
    private static final String UPSERT = """
            INSERT INTO stage_state(unit_id,step,state,retry_used,selected_artifact,job_id,updated_at_ms)
            VALUES(?,?,?,?,?,?,?)
            ON CONFLICT(unit_id,step) DO UPDATE SET
                state=excluded.state,
                retry_used=excluded.retry_used,
                selected_artifact=excluded.selected_artifact,
                job_id=excluded.job_id,
                updated_at_ms=excluded.updated_at_ms
            """;
    private static final String INSERT_TRANSITION = """
            INSERT INTO stage_transition(unit_id,step,from_state,event,action,to_state,detail,occurred_at_ms)
            VALUES(?,?,?,?,?,?,?,?)
            """;

    private final Database database;

    public StageStateStore(Database database) {
        this.database = database;
    }

    public Map<PipelineStep, StageRecord> load(String unitId) {
        Map<PipelineStep, StageRecord> out = new EnumMap<>(PipelineStep.class);
        String sql = "SELECT step,state,retry_used,selected_artifact,job_id,updated_at_ms FROM stage_state WHERE unit_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, unitId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    PipelineStep step = PipelineStep.valueOf(rs.getString("step"));
                    out.put(step, new StageRecord(
                            unitId,
                            step,
                            StageState.fromString(rs.getString("state")),
                            rs.getInt("retry_used") == 1,
                            rs.getString("selected_artifact"),
                            rs.getString("job_id"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load stage state: " + unitId, e);
        }
    }

    public void save(StageRecord record) {
        save(List.of(record), null);
    }

    /**
     * Writes the updated records and the transition that produced them in one transaction.
     */
    public void save(List<StageRecord> records, TransitionEntry transition) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(UPSERT);
                 PreparedStatement tr = c.prepareStatement(INSERT_TRANSITION)) {
                for (StageRecord record : records) {
                    up.setString(1, record.unitId());
                    up.setString(2, record.step().name());
                    up.setString(3, record.state().name());
                    up.setInt(4, record.retryUsed() ? 1 : 0);
                    up.setString(5, record.selectedArtifact());
                    up.setString(6, record.jobId());
                    up.setLong(7, record.updatedAtMs());
                    up.executeUpdate();
                }
                if (transition != null) {
                    tr.setString(1, transition.unitId());
                    tr.setString(2, transition.step().name());
                    tr.setString(3, transition.fromState().name());
                    tr.setString(4, transition.event());
                    tr.setString(5, transition.action());
                    tr.setString(6, transition.toState().name());
                    tr.setString(7, transition.detail());
                    tr.setLong(8, transition.occurredAtMs());
                    tr.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save stage state", e);
        }
    }

    public List<TransitionEntry> history(String unitId, int limit) {
        String sql = """
                SELECT step,from_state,event,action,to_state,detail,occurred_at_ms
                FROM stage_transition
                WHERE unit_id=?
                ORDER BY id DESC
                LIMIT ?
                """;
        List<TransitionEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, unitId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TransitionEntry(
                            unitId,
                            PipelineStep.valueOf(rs.getString("step")),
                            StageState.fromString(rs.getString("from_state")),
                            rs.getString("event"),
                            rs.getString("action"),
                            StageState.fromString(rs.getString("to_state")),
                            rs.getString("detail"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read transition history: " + unitId, e);
        }
    }

    public record TransitionEntry(
            String unitId,
            PipelineStep step,
            StageState fromState,
            String event,
            String action,
            StageState toState,
            String detail,
            long occurredAtMs
    ) {
    }
}
