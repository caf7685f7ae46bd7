package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.infrastructure.persistence.entity.StationEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface StationMapper {

    @Select("SELECT id, user_id, name, description, rules_json, is_enabled, created_at, updated_at "
            + "FROM station WHERE id = #{id} AND user_id = #{userId}")
    StationEntity selectByIdAndUserId(@Param("id") Long id, @Param("userId") Long userId);
}
