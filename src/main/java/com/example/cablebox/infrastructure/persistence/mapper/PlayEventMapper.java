package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.infrastructure.persistence.entity.PlayEventEntity;
import com.example.cablebox.infrastructure.persistence.model.LastPlayedRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface PlayEventMapper {

    @Insert("INSERT INTO play_event (user_id, station_id, track_id, played_at, skipped, listen_seconds, "
            + "start_offset_sec, reason) "
            + "VALUES (#{userId}, #{stationId}, #{trackId}, #{playedAt}, #{skipped}, #{listenSeconds}, "
            + "#{startOffsetSec}, #{reason})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    void insert(PlayEventEntity entity);

    /**
     * Attach the listener's report to the latest play of the track on the
     * station. Returns the number of rows changed, 0 when none exists.
     */
    @Update("UPDATE play_event SET skipped = #{skipped}, listen_seconds = #{listenSeconds} "
            + "WHERE user_id = #{userId} AND station_id = #{stationId} AND track_id = #{trackId} "
            + "ORDER BY played_at DESC, id DESC LIMIT 1")
    int updateLatestListen(@Param("userId") Long userId,
                           @Param("stationId") Long stationId,
                           @Param("trackId") String trackId,
                           @Param("skipped") Integer skipped,
                           @Param("listenSeconds") Integer listenSeconds);

    /**
     * Ids among {@code trackIds} this user played at or after {@code since},
     * on any station.
     */
    @Select("<script>"
            + "SELECT DISTINCT pe.track_id "
            + "FROM play_event pe "
            + "WHERE pe.user_id = #{userId} "
            + "AND pe.played_at &gt;= #{since} "
            + "AND pe.track_id IN "
            + "<foreach item='id' collection='trackIds' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    List<String> selectRecentlyPlayedIds(@Param("userId") Long userId,
                                         @Param("trackIds") List<String> trackIds,
                                         @Param("since") LocalDateTime since);

    /**
     * Most recent play per track across the user's whole history.
     */
    @Select("<script>"
            + "SELECT pe.track_id AS trackId, MAX(pe.played_at) AS lastPlayedAt "
            + "FROM play_event pe "
            + "WHERE pe.user_id = #{userId} "
            + "AND pe.track_id IN "
            + "<foreach item='id' collection='trackIds' open='(' separator=',' close=')'>#{id}</foreach>"
            + " GROUP BY pe.track_id"
            + "</script>")
    List<LastPlayedRow> selectLastPlayedPerTrack(@Param("userId") Long userId,
                                                 @Param("trackIds") List<String> trackIds);
}
