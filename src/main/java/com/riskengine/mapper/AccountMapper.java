package com.riskengine.mapper;

import com.riskengine.domain.model.Account;
import com.riskengine.entity.AccountEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from AccountEntity to the Account domain model.
 */
@Mapper
public interface AccountMapper {

    Account toDomain(AccountEntity entity);

    List<Account> toDomainList(List<AccountEntity> entities);
}
