package com.work.escrow.demo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.escrow.demo.event.EscrowEventStore;
import com.work.escrow.demo.event.MybatisEscrowEventStore;
import com.work.escrow.demo.repository.mapper.EscrowEventMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 事件落库装配：
 * 当 escrow.event-store=jdbc 时启用，表结构见 db/schema.sql。
 */
@Configuration
@ConditionalOnProperty(prefix = "escrow", name = "event-store", havingValue = "jdbc")
@MapperScan("com.work.escrow.demo.repository.mapper")
public class MybatisEventStoreConfiguration {

    @Bean
    public EscrowEventStore mybatisEscrowEventStore(EscrowEventMapper mapper, ObjectMapper objectMapper) {
        return new MybatisEscrowEventStore(mapper, objectMapper);
    }
}
