package com.riskengine.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.enums.ActivityType;
import com.riskengine.domain.enums.PositionDirection;
import com.riskengine.domain.enums.PositionStatus;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.model.Position;
import com.riskengine.entity.AccountEntity;
import com.riskengine.entity.ActivityEntity;
import com.riskengine.entity.PositionEntity;
import com.riskengine.mapper.AccountMapper;
import com.riskengine.mapper.AuditMapper;
import com.riskengine.mapper.PositionMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for the MapStruct mappers between JPA entities and domain models.
 */
class RiskEntityMapperTest {

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);
    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);
    private final AuditMapper auditMapper = Mappers.getMapper(AuditMapper.class);

    @Test
    @DisplayName("Account: status, active flag, breach reason and day baseline are carried over")
    void accountToDomain() {
        AccountEntity entity = AccountEntity.builder()
                .id("acc-1")
                .netWorth(new BigDecimal("9801.39407"))
                .startingBalance(new BigDecimal("10000"))
                .dayStartBalance(new BigDecimal("10000"))
                .dayStartEquity(new BigDecimal("10050"))
                .dayStartDate(LocalDate.of(2026, 3, 2))
                .accountStatus(AccountStatus.BREACHED)
                .active(false)
                .breachReason("Max drawdown reached (10.00%). Equity: $9000.00")
                .updatedAt(Instant.parse("2026-03-02T10:00:00Z"))
                .build();

        Account account = accountMapper.toDomain(entity);

        assertThat(account.getId()).isEqualTo("acc-1");
        assertThat(account.getNetWorth()).isEqualByComparingTo("9801.39407");
        assertThat(account.getDayStartEquity()).isEqualByComparingTo("10050");
        assertThat(account.getDayStartDate()).isEqualTo(LocalDate.of(2026, 3, 2));
        assertThat(account.isBreached()).isTrue();
        assertThat(account.isActive()).isFalse();
        assertThat(account.getBreachReason()).startsWith("Max drawdown");
    }

    @Test
    @DisplayName("Position list keeps order and open state")
    void positionsToDomain() {
        PositionEntity first = PositionEntity.builder()
                .id("p1")
                .accountId("acc-1")
                .symbol("BTC-USD")
                .direction(PositionDirection.LONG)
                .quantity(new BigDecimal("0.01"))
                .leverage(10)
                .entryPrice(new BigDecimal("67971.44"))
                .status(PositionStatus.OPEN)
                .build();
        PositionEntity second = PositionEntity.builder()
                .id("p2")
                .accountId("acc-1")
                .symbol("ETH-USD")
                .direction(PositionDirection.SHORT)
                .quantity(BigDecimal.ONE)
                .leverage(5)
                .entryPrice(new BigDecimal("3000"))
                .status(PositionStatus.OPEN)
                .build();

        List<Position> positions = positionMapper.toDomainList(List.of(first, second));

        assertThat(positions).extracting(Position::getId).containsExactly("p1", "p2");
        assertThat(positions.get(0).isLong()).isTrue();
        assertThat(positions.get(0).getLeverage()).isEqualTo(10);
        assertThat(positions.get(1).isOpen()).isTrue();
    }

    @Test
    @DisplayName("Activity record maps to a new row without an id")
    void activityToEntity() {
        ActivityRecord record = ActivityRecord.builder()
                .accountId("acc-1")
                .type(ActivityType.CLOSED)
                .title("SL Long BTC-USD")
                .detail("0.01 @ $65990.00 | -$198.14")
                .pnl(new BigDecimal("-198.1440"))
                .occurredAt(Instant.parse("2026-03-02T10:00:00Z"))
                .build();

        ActivityEntity entity = auditMapper.toEntity(record);

        assertThat(entity.getId()).isNull();
        assertThat(entity.getType()).isEqualTo(ActivityType.CLOSED);
        assertThat(entity.getTitle()).isEqualTo("SL Long BTC-USD");
        assertThat(entity.getPnl()).isEqualByComparingTo("-198.1440");
    }
}
