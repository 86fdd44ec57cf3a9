package com.work.escrow.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.escrow.demo.repository.entity.EscrowEventEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface EscrowEventMapper extends BaseMapper<EscrowEventEntity> {

    @Select("SELECT seq, event_type, item_id, buyer_address, payload, occurred_at FROM escrow_events "
            + "WHERE seq > COALESCE(#{afterSeq}, 0) ORDER BY seq ASC LIMIT #{limit}")
    List<EscrowEventEntity> listAfterSeq(@Param("afterSeq") Long afterSeq, @Param("limit") int limit);
}
