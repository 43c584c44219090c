package com.retail.loyalty_backend.modules.points.mapper;

import com.retail.loyalty_backend.modules.points.entity.LoyaltyOrder;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface LoyaltyOrderMapper {

    /**
     * 登记订单；同一用户的订单号已存在时忽略并返回 0。
     */
    int insertIgnore(LoyaltyOrder order);
}
