package com.example.adaptivestream.infrastructure.persistence.mapper;

import com.example.adaptivestream.infrastructure.persistence.entity.ProviderScoreEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ProviderScoreMapper {

    @Select("SELECT provider_name, score, consecutive_failures, updated_at FROM provider_score")
    List<ProviderScoreEntity> selectAll();

    @Insert("INSERT INTO provider_score(provider_name, score, consecutive_failures, updated_at) "
            + "VALUES(#{providerName}, #{score}, #{consecutiveFailures}, NOW()) "
            + "ON DUPLICATE KEY UPDATE "
            + "score = VALUES(score), consecutive_failures = VALUES(consecutive_failures), updated_at = NOW()")
    int upsert(ProviderScoreEntity entity);
}
