package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.infrastructure.persistence.entity.TrackFeedbackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackFeedbackMapper {

    @Select("<script>"
            + "SELECT user_id, track_id, liked, disliked "
            + "FROM track_feedback "
            + "WHERE user_id = #{userId} "
            + "AND track_id IN "
            + "<foreach item='id' collection='trackIds' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    List<TrackFeedbackEntity> selectByUserAndTrackIds(@Param("userId") Long userId,
                                                      @Param("trackIds") List<String> trackIds);
}
