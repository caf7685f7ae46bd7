package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.infrastructure.persistence.entity.StationStateEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface StationStateMapper {

    @Select("SELECT station_id, user_id, recent_track_ids_json, recent_artist_names_json, last_track_id, "
            + "last_played_at, updated_at "
            + "FROM station_state WHERE station_id = #{stationId}")
    StationStateEntity selectByStationId(@Param("stationId") Long stationId);

    @Insert("INSERT INTO station_state (station_id, user_id, recent_track_ids_json, recent_artist_names_json, "
            + "last_track_id, last_played_at) "
            + "VALUES (#{stationId}, #{userId}, #{recentTrackIdsJson}, #{recentArtistNamesJson}, "
            + "#{lastTrackId}, #{lastPlayedAt}) "
            + "ON DUPLICATE KEY UPDATE "
            + "recent_track_ids_json = VALUES(recent_track_ids_json), "
            + "recent_artist_names_json = VALUES(recent_artist_names_json), "
            + "last_track_id = VALUES(last_track_id), "
            + "last_played_at = VALUES(last_played_at), "
            + "updated_at = NOW()")
    int upsert(StationStateEntity entity);
}
