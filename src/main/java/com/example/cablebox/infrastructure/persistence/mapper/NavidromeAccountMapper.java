package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.infrastructure.persistence.entity.NavidromeAccountEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface NavidromeAccountMapper {

    @Select("SELECT user_id, base_url, username, token, salt "
            + "FROM navidrome_account WHERE user_id = #{userId}")
    NavidromeAccountEntity selectByUserId(@Param("userId") Long userId);
}
