package com.example.adaptivestream.infrastructure.persistence.mapper;

import com.example.adaptivestream.infrastructure.persistence.entity.ValidatedContentEntity;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ValidatedContentMapper {

    @Select("SELECT content_id, duration_sec, total_bytes, validated_at "
            + "FROM validated_content WHERE content_id = #{contentId}")
    ValidatedContentEntity selectByContentId(@Param("contentId") String contentId);

    @Insert("INSERT INTO validated_content(content_id, duration_sec, total_bytes, validated_at) "
            + "VALUES(#{contentId}, #{durationSec}, #{totalBytes}, #{validatedAt}) "
            + "ON DUPLICATE KEY UPDATE "
            + "duration_sec = VALUES(duration_sec), total_bytes = VALUES(total_bytes), "
            + "validated_at = VALUES(validated_at)")
    int upsert(ValidatedContentEntity entity);

    @Delete("DELETE FROM validated_content WHERE validated_at < #{before}")
    int deleteValidatedBefore(@Param("before") LocalDateTime before);
}
